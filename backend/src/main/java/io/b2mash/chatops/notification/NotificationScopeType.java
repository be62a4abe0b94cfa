package io.b2mash.chatops.notification;

public enum NotificationScopeType {
  USER,
  ORGANIZATION,
  PROJECT
}
