package io.b2mash.chatops.notification;

public enum NotificationSettingValue {
  /** No row stored; inherit from the parent scope. */
  DEFAULT,
  NEVER,
  ALWAYS,
  /** Only for issues the target is subscribed to. */
  SUBSCRIBE_ONLY,
  /** Only for deploys containing the target's commits. */
  COMMITTED_ONLY
}
