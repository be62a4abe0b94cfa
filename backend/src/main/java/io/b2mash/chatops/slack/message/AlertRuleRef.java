package io.b2mash.chatops.slack.message;

public record AlertRuleRef(long id, String label) {}
