package io.b2mash.chatops.slack.message;

import java.util.List;

public record OptionGroup(String text, List<ActionOption> options) {}
