package io.b2mash.chatops.slack.message;

import java.util.List;

/**
 * An action a Slack user took on an attachment: a status button ({@code name=status}, {@code
 * value=resolved|ignored|unresolved}, optionally followed by {@code :params}) or the assignee
 * select ({@code name=assign}).
 */
public record InteractionAction(String name, String value, List<ActionOption> selectedOptions) {

  public static InteractionAction status(String value) {
    return new InteractionAction("status", value, List.of());
  }

  public static InteractionAction assign(String assigneeValue) {
    return new InteractionAction("assign", null, List.of(new ActionOption(null, assigneeValue)));
  }
}
