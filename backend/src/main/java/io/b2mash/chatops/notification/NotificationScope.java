package io.b2mash.chatops.notification;

/**
 * Where a setting applies. Organization ids are UUIDs while user and project ids are numeric, so
 * the identifier is kept in its string form.
 */
public record NotificationScope(NotificationScopeType type, String identifier) {}
