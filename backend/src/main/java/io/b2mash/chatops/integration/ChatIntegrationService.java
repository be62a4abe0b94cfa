package io.b2mash.chatops.integration;

import io.b2mash.chatops.exception.ResourceNotFoundException;
import io.b2mash.chatops.integration.secret.SecretStore;
import io.b2mash.chatops.slack.client.SlackCredentials;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Installs chat workspaces for organizations and hands out their credentials. */
@Service
public class ChatIntegrationService {

  private static final Logger log = LoggerFactory.getLogger(ChatIntegrationService.class);

  public static final String SLACK_PROVIDER = "slack";

  private final ChatIntegrationRepository integrationRepository;
  private final SecretStore secretStore;

  public ChatIntegrationService(
      ChatIntegrationRepository integrationRepository, SecretStore secretStore) {
    this.integrationRepository = integrationRepository;
    this.secretStore = secretStore;
  }

  /**
   * Records a Slack workspace install. Re-installing the same workspace for the same organization
   * reactivates the existing row and replaces its token.
   */
  @Transactional
  public ChatIntegration installSlack(UUID organizationId, SlackInstallation installation) {
    var installationType =
        InstallationType.infer(
            installation.installationType(), installation.userAccessToken() != null);

    var integration =
        integrationRepository
            .findByOrganizationIdAndProviderAndExternalId(
                organizationId, SLACK_PROVIDER, installation.teamId())
            .orElseGet(
                () ->
                    new ChatIntegration(
                        organizationId,
                        SLACK_PROVIDER,
                        installation.teamId(),
                        installation.teamName(),
                        installationType));
    integration.rename(installation.teamName());
    integration.activate();
    integration = integrationRepository.save(integration);

    secretStore.store(accessTokenKey(integration.getId()), installation.accessToken());
    log.info(
        "Installed slack integration: organizationId={}, integrationId={}, teamId={}, type={}",
        organizationId,
        integration.getId(),
        installation.teamId(),
        installationType.getSlug());
    return integration;
  }

  @Transactional
  public void disable(UUID organizationId, UUID integrationId) {
    var integration = requireActive(organizationId, integrationId);
    integration.disable();
    secretStore.delete(accessTokenKey(integrationId));
    log.info(
        "Disabled slack integration: organizationId={}, integrationId={}",
        organizationId,
        integrationId);
  }

  @Transactional(readOnly = true)
  public Optional<ChatIntegration> findActive(UUID organizationId, UUID integrationId) {
    return integrationRepository.findByIdAndOrganizationIdAndStatus(
        integrationId, organizationId, IntegrationStatus.ACTIVE);
  }

  @Transactional(readOnly = true)
  public ChatIntegration requireActive(UUID organizationId, UUID integrationId) {
    return findActive(organizationId, integrationId)
        .orElseThrow(() -> new ResourceNotFoundException("Integration", integrationId));
  }

  public SlackCredentials credentialsFor(ChatIntegration integration) {
    return new SlackCredentials(secretStore.retrieve(accessTokenKey(integration.getId())));
  }

  static String accessTokenKey(UUID integrationId) {
    return SLACK_PROVIDER + ":" + integrationId + ":access_token";
  }

  /** OAuth install payload as returned by Slack's {@code oauth.v2.access}. */
  public record SlackInstallation(
      String teamId,
      String teamName,
      String accessToken,
      String userAccessToken,
      String installationType) {}
}
