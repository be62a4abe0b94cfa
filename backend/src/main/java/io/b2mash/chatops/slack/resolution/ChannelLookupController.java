package io.b2mash.chatops.slack.resolution;

import io.b2mash.chatops.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Channel lookups for alert-rule forms. */
@RestController
public class ChannelLookupController {

  private final ChannelIdService channelIdService;
  private final AsyncChannelLookupService asyncLookupService;

  public ChannelLookupController(
      ChannelIdService channelIdService, AsyncChannelLookupService asyncLookupService) {
    this.channelIdService = channelIdService;
    this.asyncLookupService = asyncLookupService;
  }

  /**
   * Resolves the name inline. When the inline budget runs out the lookup continues in the
   * background and 202 is returned with a lookup id to poll.
   */
  @PostMapping(
      "/api/organizations/{organizationId}/integrations/{integrationId}/slack/channel-lookups")
  @PreAuthorize(
      "hasAnyRole('ORG_ADMIN', 'ORG_OWNER')"
          + " and @organizationAccess.isCurrent(authentication, #organizationId)")
  public ResponseEntity<ChannelLookupResponse> lookup(
      @PathVariable UUID organizationId,
      @PathVariable UUID integrationId,
      @Valid @RequestBody ChannelLookupRequest request) {
    var lookup =
        channelIdService.resolveChannelId(organizationId, integrationId, request.name(), false);

    if (lookup.timedOut()) {
      var lookupId = asyncLookupService.enqueue(organizationId, integrationId, request.name());
      return ResponseEntity.status(HttpStatus.ACCEPTED)
          .body(
              new ChannelLookupResponse(
                  ChannelLookupStatus.State.PENDING, lookupId, null, null, null));
    }
    if (!lookup.found()) {
      throw ResourceNotFoundException.withDetail(
          "Channel not found",
          "The Slack channel or user '" + request.name() + "' does not exist or is not accessible.");
    }
    return ResponseEntity.ok(
        new ChannelLookupResponse(
            ChannelLookupStatus.State.SUCCESS, null, lookup.prefix(), lookup.channelId(), null));
  }

  @GetMapping("/api/slack/channel-lookups/{lookupId}")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<ChannelLookupResponse> lookupStatus(@PathVariable UUID lookupId) {
    var status =
        asyncLookupService
            .getStatus(lookupId)
            .orElseThrow(() -> new ResourceNotFoundException("Channel lookup", lookupId));
    return ResponseEntity.ok(ChannelLookupResponse.from(status));
  }

  // --- DTOs ---

  public record ChannelLookupRequest(@NotBlank String name) {}

  public record ChannelLookupResponse(
      ChannelLookupStatus.State status,
      UUID lookupId,
      String prefix,
      String channelId,
      String detail) {

    static ChannelLookupResponse from(ChannelLookupStatus status) {
      return new ChannelLookupResponse(
          status.state(), status.lookupId(), status.prefix(), status.channelId(), status.detail());
    }
  }
}
