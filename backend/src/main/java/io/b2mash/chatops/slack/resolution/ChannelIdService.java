package io.b2mash.chatops.slack.resolution;

import io.b2mash.chatops.integration.ChatIntegrationService;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Resolves channel names for an organization's installed Slack workspace. */
@Service
public class ChannelIdService {

  private static final Logger log = LoggerFactory.getLogger(ChannelIdService.class);

  private final ChatIntegrationService integrationService;
  private final ResolutionScheduler resolutionScheduler;

  public ChannelIdService(
      ChatIntegrationService integrationService, ResolutionScheduler resolutionScheduler) {
    this.integrationService = integrationService;
    this.resolutionScheduler = resolutionScheduler;
  }

  /**
   * Looks up the Slack id behind {@code rawName} ({@code #channel}, {@code @user} or a bare name).
   *
   * @param useAsyncLookup true when already running in a background job, which allows the long
   *     time budget
   * @throws io.b2mash.chatops.exception.ResourceNotFoundException if the integration is not active
   *     for the organization
   * @throws io.b2mash.chatops.exception.DuplicateDisplayNameException if the name is an ambiguous
   *     display name
   */
  public ChannelLookup resolveChannelId(
      UUID organizationId, UUID integrationId, String rawName, boolean useAsyncLookup) {
    var integration = integrationService.requireActive(organizationId, integrationId);
    var credentials = integrationService.credentialsFor(integration);

    var result = resolutionScheduler.resolveChannel(rawName, credentials, useAsyncLookup);
    log.debug(
        "Channel lookup finished: integrationId={}, name={}, status={}, async={}",
        integrationId,
        rawName,
        result.status(),
        useAsyncLookup);
    return ChannelLookup.from(result);
  }
}
