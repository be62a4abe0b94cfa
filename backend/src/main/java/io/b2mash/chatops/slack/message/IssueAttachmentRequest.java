package io.b2mash.chatops.slack.message;

import java.util.List;
import java.util.Set;

/**
 * Everything {@link IssueAttachmentBuilder} needs to render one issue.
 *
 * @param event the triggering event, or null to describe the issue itself
 * @param tags tag keys to show as fields
 * @param actorSlackId Slack user id of whoever performed {@code actions}
 * @param actions actions already taken from Slack; when present the buttons are removed
 * @param rules alert rules that fired; the first one is linked in the footer
 */
public record IssueAttachmentRequest(
    IssueSummary issue,
    EventDetails event,
    Set<String> tags,
    String actorSlackId,
    List<InteractionAction> actions,
    List<AlertRuleRef> rules,
    boolean linkToEvent) {

  public IssueAttachmentRequest {
    tags = tags == null ? Set.of() : Set.copyOf(tags);
    actions = actions == null ? List.of() : List.copyOf(actions);
    rules = rules == null ? List.of() : List.copyOf(rules);
  }

  public static IssueAttachmentRequest of(IssueSummary issue) {
    return new IssueAttachmentRequest(issue, null, null, null, null, null, false);
  }

  public IssueAttachmentRequest withEvent(EventDetails event, boolean linkToEvent) {
    return new IssueAttachmentRequest(issue, event, tags, actorSlackId, actions, rules, linkToEvent);
  }

  public IssueAttachmentRequest withTags(Set<String> tags) {
    return new IssueAttachmentRequest(issue, event, tags, actorSlackId, actions, rules, linkToEvent);
  }

  public IssueAttachmentRequest withActions(String actorSlackId, List<InteractionAction> actions) {
    return new IssueAttachmentRequest(issue, event, tags, actorSlackId, actions, rules, linkToEvent);
  }

  public IssueAttachmentRequest withRules(List<AlertRuleRef> rules) {
    return new IssueAttachmentRequest(issue, event, tags, actorSlackId, actions, rules, linkToEvent);
  }
}
