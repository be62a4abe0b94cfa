package io.b2mash.chatops.notification;

/** Kinds of notification a user or team can configure. */
public enum NotificationSettingType {
  /** Catch-all for types without a dedicated setting. */
  DEFAULT,
  /** Release deploys. */
  DEPLOY,
  /** Alert rules firing for issues. */
  ISSUE_ALERTS,
  /** Activity on subscribed issues. */
  WORKFLOW
}
