package io.b2mash.chatops.notification;

/** Who a setting belongs to. */
public record NotificationTarget(NotificationTargetType type, long identifier) {}
