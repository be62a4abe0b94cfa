package io.b2mash.chatops.slack.message;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Issue (group of events) as needed for an attachment.
 *
 * @param assigneeValue current assignee as {@code user:<id>} / {@code team:<id>}, or null
 * @param latestEvent used for the level color and tags when no event is given
 */
public record IssueSummary(
    long id,
    long projectId,
    String projectSlug,
    String organizationSlug,
    String qualifiedShortId,
    String title,
    IssueStatus status,
    Instant lastSeen,
    String eventType,
    Map<String, String> metadata,
    List<TeamOption> teams,
    List<MemberOption> members,
    String assigneeValue,
    EventDetails latestEvent) {

  public IssueSummary {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    teams = teams == null ? List.of() : List.copyOf(teams);
    members = members == null ? List.of() : List.copyOf(members);
  }
}
