package io.b2mash.chatops.slack.message;

/** One entry of a select menu. {@code value} is {@code user:<id>} or {@code team:<id>}. */
public record ActionOption(String text, String value) {}
