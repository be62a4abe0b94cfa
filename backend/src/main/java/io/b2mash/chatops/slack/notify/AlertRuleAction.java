package io.b2mash.chatops.slack.notify;

import java.util.UUID;

/**
 * A metric-alert trigger action that notifies a Slack channel.
 *
 * @param targetIdentifier resolved channel or user id to post to
 * @param targetDisplay the name the channel was configured with, e.g. {@code #alerts}
 */
public record AlertRuleAction(
    UUID organizationId, UUID integrationId, String targetIdentifier, String targetDisplay) {}
