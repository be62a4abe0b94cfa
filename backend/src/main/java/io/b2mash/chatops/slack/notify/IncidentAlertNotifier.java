package io.b2mash.chatops.slack.notify;

import io.b2mash.chatops.config.SlackProperties;
import io.b2mash.chatops.integration.ChatIntegrationService;
import io.b2mash.chatops.slack.client.SlackApiClient;
import io.b2mash.chatops.slack.client.SlackApiException;
import io.b2mash.chatops.slack.message.IncidentAttachmentBuilder;
import io.b2mash.chatops.slack.message.IncidentSummary;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Posts metric-alert incidents to Slack. Delivery is fire-and-forget: Slack failures are logged
 * and never reach the alerting pipeline.
 */
@Service
public class IncidentAlertNotifier {

  private static final Logger log = LoggerFactory.getLogger(IncidentAlertNotifier.class);

  static final String POST_MESSAGE_ENDPOINT = "/chat.postMessage";

  private final ChatIntegrationService integrationService;
  private final IncidentAttachmentBuilder attachmentBuilder;
  private final SlackApiClient slackApiClient;
  private final ObjectMapper objectMapper;
  private final SlackProperties slackProperties;

  public IncidentAlertNotifier(
      ChatIntegrationService integrationService,
      IncidentAttachmentBuilder attachmentBuilder,
      SlackApiClient slackApiClient,
      ObjectMapper objectMapper,
      SlackProperties slackProperties) {
    this.integrationService = integrationService;
    this.attachmentBuilder = attachmentBuilder;
    this.slackApiClient = slackApiClient;
    this.objectMapper = objectMapper;
    this.slackProperties = slackProperties;
  }

  public void sendAlertNotification(
      AlertRuleAction action, IncidentSummary incident, Double metricValue) {
    var integration =
        integrationService.findActive(incident.organizationId(), action.integrationId());
    if (integration.isEmpty()) {
      // Integration removed while the alert rule still references it
      log.debug(
          "Skipping incident notification, integration inactive: organizationId={},"
              + " integrationId={}",
          incident.organizationId(),
          action.integrationId());
      return;
    }

    var credentials = integrationService.credentialsFor(integration.get());
    var attachment = attachmentBuilder.build(incident, metricValue);

    try {
      var payload =
          Map.of(
              "token", credentials.accessToken(),
              "channel", action.targetIdentifier(),
              "attachments", objectMapper.writeValueAsString(List.of(attachment)));
      slackApiClient.post(POST_MESSAGE_ENDPOINT, payload, slackProperties.postTimeout());
    } catch (SlackApiException e) {
      log.info(
          "rule.fail.slack_post: integrationId={}, channel={}, error={}",
          action.integrationId(),
          action.targetIdentifier(),
          e.getMessage());
      return;
    } catch (JacksonException e) {
      log.warn(
          "rule.fail.slack_post: integrationId={}, channel={}, attachment not serializable",
          action.integrationId(),
          action.targetIdentifier(),
          e);
      return;
    }

    log.info(
        "Posted incident notification: integrationId={}, channel={}, link={}",
        action.integrationId(),
        action.targetIdentifier(),
        scrubbedLink(attachment.titleLink()));
  }

  /** The message is already posted, so a link that cannot be scrubbed only degrades the log. */
  private static String scrubbedLink(String titleLink) {
    if (titleLink == null) {
      return null;
    }
    try {
      return LinkScrubber.parseLink(titleLink);
    } catch (IllegalArgumentException e) {
      log.debug("Title link not scrubbable: {}", e.getMessage());
      return "<unparseable>";
    }
  }
}
