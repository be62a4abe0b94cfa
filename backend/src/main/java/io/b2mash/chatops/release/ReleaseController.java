package io.b2mash.chatops.release;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Receives release notifications from the platform to keep the release projection current. */
@RestController
public class ReleaseController {

  private final ReleaseAvailabilityCache releaseCache;

  public ReleaseController(ReleaseAvailabilityCache releaseCache) {
    this.releaseCache = releaseCache;
  }

  @PostMapping("/api/organizations/{organizationId}/projects/{projectId}/releases")
  @PreAuthorize(
      "hasAnyRole('ORG_ADMIN', 'ORG_OWNER')"
          + " and @organizationAccess.isCurrent(authentication, #organizationId)")
  public ResponseEntity<Void> recordRelease(
      @PathVariable UUID organizationId,
      @PathVariable long projectId,
      @Valid @RequestBody ReleaseRequest request) {
    releaseCache.recordRelease(organizationId, projectId, request.version());
    return ResponseEntity.noContent().build();
  }

  public record ReleaseRequest(@NotBlank String version) {}
}
