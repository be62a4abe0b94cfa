package io.b2mash.chatops.notification;

public enum NotificationTargetType {
  USER,
  TEAM
}
