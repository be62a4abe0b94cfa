package io.b2mash.chatops.slack.message;

import java.time.Instant;
import java.util.UUID;

/**
 * A metric-alert incident as needed for an attachment.
 *
 * @param aggregate the alert rule's aggregate, e.g. {@code count()}
 * @param currentMetricValue last known metric value, used when the caller passes none
 */
public record IncidentSummary(
    UUID organizationId,
    String organizationSlug,
    long identifier,
    String alertRuleName,
    IncidentStatus status,
    String aggregate,
    int timeWindowMinutes,
    Instant dateStarted,
    Double currentMetricValue) {}
