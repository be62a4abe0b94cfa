package io.b2mash.chatops.notification;

public enum ExternalProvider {
  EMAIL,
  SLACK
}
