package io.b2mash.chatops.slack.resolution;

/**
 * One entry of a Slack listing. {@code name} is unique within its list (channel name or username);
 * {@code displayName} is the user's profile display name and is null for channels.
 */
public record ListItem(String id, String name, String displayName) {}
