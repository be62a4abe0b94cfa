package io.b2mash.chatops.slack.message;

import io.b2mash.chatops.release.ReleaseAvailabilityCache;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Builds the legacy Slack attachment for an issue notification, including the interactive
 * resolve / ignore buttons and the assignee select.
 */
@Component
public class IssueAttachmentBuilder {

  private final SlackColorPalette palette;
  private final ReleaseAvailabilityCache releaseCache;
  private final PlatformUrls urls;

  public IssueAttachmentBuilder(
      SlackColorPalette palette, ReleaseAvailabilityCache releaseCache, PlatformUrls urls) {
    this.palette = palette;
    this.releaseCache = releaseCache;
    this.urls = urls;
  }

  public SlackAttachment build(IssueAttachmentRequest request) {
    var issue = request.issue();
    var event = request.event();

    var text = Optional.ofNullable(attachmentText(issue, event)).orElse("");
    List<AttachmentAction> actions = actionsFor(issue);

    // Tags come from the latest event when no event was given
    var eventForTags = event != null ? event : issue.latestEvent();
    var color =
        eventForTags != null
            ? palette.colorForLevel(eventForTags.tag("level"))
            : palette.colorForLevel(null);

    var fields = tagFields(eventForTags, request);

    if (!request.actions().isEmpty()) {
      var actionTexts =
          request.actions().stream()
              .map(a -> ActionTextFormatter.format(issue, request.actorSlackId(), a))
              .flatMap(Optional::stream)
              .toList();
      text += "\n" + String.join("\n", actionTexts);
      color = palette.actionedColor();
      actions = List.of();
    }

    var ts = issue.lastSeen();
    if (event != null && event.datetime() != null && event.datetime().isAfter(ts)) {
      ts = event.datetime();
    }

    var titleLink =
        event != null && request.linkToEvent()
            ? urls.issueUrl(issue.organizationSlug(), issue.id(), event.eventId())
            : urls.issueUrl(issue.organizationSlug(), issue.id(), null);

    var displayTitle = event != null ? event.title() : issue.title();

    return new SlackAttachment(
        "[" + issue.projectSlug() + "] " + displayTitle,
        attachmentTitle(issue, event),
        titleLink,
        text,
        fields,
        List.of("text"),
        "{\"issue\":" + issue.id() + "}",
        urls.logoUrl(),
        footer(issue, request.rules()),
        epochSeconds(ts),
        color,
        actions);
  }

  static String attachmentTitle(IssueSummary issue, EventDetails event) {
    var eventType = event != null ? event.eventType() : issue.eventType();
    var metadata = event != null ? event.metadata() : issue.metadata();
    var title = event != null ? event.title() : issue.title();

    if ("error".equals(eventType) && metadata.containsKey("type")) {
      return metadata.get("type");
    }
    if ("csp".equals(eventType)) {
      return metadata.get("directive") + " - " + metadata.get("uri");
    }
    return title;
  }

  static String attachmentText(IssueSummary issue, EventDetails event) {
    var eventType = event != null ? event.eventType() : issue.eventType();
    var metadata = event != null ? event.metadata() : issue.metadata();

    if (!"error".equals(eventType)) {
      return null;
    }
    var value = metadata.get("value");
    return value != null && !value.isEmpty() ? value : metadata.get("function");
  }

  private List<AttachmentAction> actionsFor(IssueSummary issue) {
    AttachmentAction resolve;
    if (issue.status() == IssueStatus.RESOLVED) {
      resolve = AttachmentAction.button("status", "unresolved", "Unresolve");
    } else if (releaseCache.hasReleases(issue.projectId())) {
      resolve = AttachmentAction.button("resolve_dialog", "resolve_dialog", "Resolve...");
    } else {
      resolve = AttachmentAction.button("status", "resolved", "Resolve");
    }

    var ignore =
        issue.status() == IssueStatus.IGNORED
            ? AttachmentAction.button("status", "unresolved", "Stop Ignoring")
            : AttachmentAction.button("status", "ignored", "Ignore");

    return List.of(resolve, ignore, assigneeSelect(issue));
  }

  private static AttachmentAction assigneeSelect(IssueSummary issue) {
    var optionGroups = new ArrayList<OptionGroup>();
    if (!issue.teams().isEmpty()) {
      optionGroups.add(
          new OptionGroup(
              "Teams", issue.teams().stream().map(TeamOption::toActionOption).toList()));
    }
    if (!issue.members().isEmpty()) {
      optionGroups.add(
          new OptionGroup(
              "People",
              issue.members().stream()
                  .sorted(Comparator.comparing(MemberOption::displayName))
                  .map(MemberOption::toActionOption)
                  .toList()));
    }

    List<ActionOption> selected = currentAssignee(issue).map(List::of).orElse(List.of());
    return AttachmentAction.select("assign", "Select Assignee...", selected, optionGroups);
  }

  private static Optional<ActionOption> currentAssignee(IssueSummary issue) {
    var value = issue.assigneeValue();
    if (value == null) {
      return Optional.empty();
    }
    return ActionTextFormatter.assigneeLabel(issue, value)
        .map(label -> new ActionOption(label, value));
  }

  private static List<AttachmentField> tagFields(
      EventDetails eventForTags, IssueAttachmentRequest request) {
    if (request.tags().isEmpty() || eventForTags == null) {
      return List.of();
    }
    return eventForTags.tags().stream()
        .filter(tag -> request.tags().contains(tag.standardizedKey()))
        .map(tag -> new AttachmentField(tag.standardizedKey(), tag.value(), true))
        .toList();
  }

  private String footer(IssueSummary issue, List<AlertRuleRef> rules) {
    var footer = new StringBuilder(issue.qualifiedShortId());
    if (!rules.isEmpty()) {
      var first = rules.get(0);
      var ruleUrl = urls.ruleUrl(issue.organizationSlug(), issue.projectSlug(), first.id());
      footer.append(" via <").append(ruleUrl).append('|').append(first.label()).append('>');
      if (rules.size() > 1) {
        footer.append(" (+").append(rules.size() - 1).append(" other)");
      }
    }
    return footer.toString();
  }

  private static Long epochSeconds(Instant ts) {
    return ts != null ? ts.getEpochSecond() : null;
  }
}
