package io.b2mash.chatops.slack.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AttachmentField(String title, String value, @JsonProperty("short") boolean isShort) {}
