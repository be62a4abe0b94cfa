package io.b2mash.chatops.slack.message;

import java.util.Map;
import java.util.Optional;

/** Renders the "*Issue resolved by @someone*" lines appended after an interaction. */
final class ActionTextFormatter {

  private static final Map<String, String> STATUS_TEXT =
      Map.of("resolved", "resolved", "ignored", "ignored", "unresolved", "re-opened");

  private ActionTextFormatter() {}

  static Optional<String> format(IssueSummary issue, String actorSlackId, InteractionAction action) {
    if ("assign".equals(action.name())) {
      if (action.selectedOptions().isEmpty()) {
        return Optional.empty();
      }
      return assignedText(issue, actorSlackId, action.selectedOptions().get(0).value());
    }

    if (action.value() == null) {
      return Optional.empty();
    }
    // resolve actions may carry parameters after ':'
    var status = action.value().split(":", 2)[0];
    var text = STATUS_TEXT.get(status);
    if (text == null) {
      return Optional.empty();
    }
    return Optional.of("*Issue " + text + " by <@" + actorSlackId + ">*");
  }

  private static Optional<String> assignedText(
      IssueSummary issue, String actorSlackId, String assigneeValue) {
    return assigneeLabel(issue, assigneeValue)
        .map(label -> "*Issue assigned to " + label + " by <@" + actorSlackId + ">*");
  }

  /** Team as {@code #slug}; user as a Slack mention when linked, else the display name. */
  static Optional<String> assigneeLabel(IssueSummary issue, String assigneeValue) {
    if (assigneeValue == null) {
      return Optional.empty();
    }
    var parts = assigneeValue.split(":", 2);
    if (parts.length != 2) {
      return Optional.empty();
    }
    long id;
    try {
      id = Long.parseLong(parts[1]);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }

    return switch (parts[0]) {
      case "team" ->
          issue.teams().stream()
              .filter(t -> t.teamId() == id)
              .map(t -> "#" + t.slug())
              .findFirst();
      case "user" ->
          issue.members().stream()
              .filter(m -> m.userId() == id)
              .map(m -> m.slackUserId() != null ? "<@" + m.slackUserId() + ">" : m.displayName())
              .findFirst();
      default -> Optional.empty();
    };
  }
}
