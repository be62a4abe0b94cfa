package io.b2mash.chatops.integration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/organizations/{organizationId}/integrations/slack")
public class ChatIntegrationController {

  private final ChatIntegrationService integrationService;

  public ChatIntegrationController(ChatIntegrationService integrationService) {
    this.integrationService = integrationService;
  }

  @PostMapping
  @PreAuthorize(
      "hasAnyRole('ORG_ADMIN', 'ORG_OWNER')"
          + " and @organizationAccess.isCurrent(authentication, #organizationId)")
  public ResponseEntity<IntegrationResponse> install(
      @PathVariable UUID organizationId, @Valid @RequestBody InstallRequest request) {
    var integration =
        integrationService.installSlack(
            organizationId,
            new ChatIntegrationService.SlackInstallation(
                request.teamId(),
                request.teamName(),
                request.accessToken(),
                request.userAccessToken(),
                request.installationType()));
    return ResponseEntity.status(HttpStatus.CREATED).body(IntegrationResponse.from(integration));
  }

  @DeleteMapping("/{integrationId}")
  @PreAuthorize(
      "hasAnyRole('ORG_ADMIN', 'ORG_OWNER')"
          + " and @organizationAccess.isCurrent(authentication, #organizationId)")
  public ResponseEntity<Void> disable(
      @PathVariable UUID organizationId, @PathVariable UUID integrationId) {
    integrationService.disable(organizationId, integrationId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record InstallRequest(
      @NotBlank String teamId,
      @NotBlank String teamName,
      @NotBlank String accessToken,
      String userAccessToken,
      String installationType) {}

  public record IntegrationResponse(
      UUID id,
      String provider,
      String externalId,
      String name,
      String installationType,
      IntegrationStatus status,
      Instant createdAt) {

    static IntegrationResponse from(ChatIntegration integration) {
      return new IntegrationResponse(
          integration.getId(),
          integration.getProvider(),
          integration.getExternalId(),
          integration.getName(),
          integration.getInstallationType().getSlug(),
          integration.getStatus(),
          integration.getCreatedAt());
    }
  }
}
