package io.b2mash.chatops.notification;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/organizations/{organizationId}/notification-settings")
public class NotificationSettingController {

  static final String SETTINGS_ACCESS =
      "hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')"
          + " and @organizationAccess.isCurrent(authentication, #organizationId)"
          + " and @organizationAccess.canManageSettingsOf(authentication, #userId)";

  private final NotificationSettingsService settingsService;

  public NotificationSettingController(NotificationSettingsService settingsService) {
    this.settingsService = settingsService;
  }

  @GetMapping
  @PreAuthorize(SETTINGS_ACCESS)
  public ResponseEntity<SettingResponse> getSetting(
      @PathVariable UUID organizationId,
      @RequestParam ExternalProvider provider,
      @RequestParam NotificationSettingType type,
      @RequestParam(required = false) Long userId,
      @RequestParam(required = false) Long teamId,
      @RequestParam(required = false) Long projectId,
      @RequestParam(defaultValue = "false") boolean organizationScope) {
    var coordinates = coordinates(organizationId, userId, teamId, projectId, organizationScope);
    var value = settingsService.getSetting(provider, type, coordinates);
    return ResponseEntity.ok(new SettingResponse(provider, type, value));
  }

  @PutMapping
  @PreAuthorize(SETTINGS_ACCESS)
  public ResponseEntity<SettingResponse> updateSetting(
      @PathVariable UUID organizationId,
      @RequestParam ExternalProvider provider,
      @RequestParam NotificationSettingType type,
      @RequestParam(required = false) Long userId,
      @RequestParam(required = false) Long teamId,
      @RequestParam(required = false) Long projectId,
      @RequestParam(defaultValue = "false") boolean organizationScope,
      @Valid @RequestBody UpdateSettingRequest request) {
    var coordinates = coordinates(organizationId, userId, teamId, projectId, organizationScope);
    settingsService.updateSetting(provider, type, request.value(), coordinates);
    return ResponseEntity.ok(new SettingResponse(provider, type, request.value()));
  }

  @DeleteMapping
  @PreAuthorize(SETTINGS_ACCESS)
  public ResponseEntity<Void> removeSetting(
      @PathVariable UUID organizationId,
      @RequestParam ExternalProvider provider,
      @RequestParam NotificationSettingType type,
      @RequestParam(required = false) Long userId,
      @RequestParam(required = false) Long teamId,
      @RequestParam(required = false) Long projectId,
      @RequestParam(defaultValue = "false") boolean organizationScope) {
    var coordinates = coordinates(organizationId, userId, teamId, projectId, organizationScope);
    settingsService.removeSetting(provider, type, coordinates);
    return ResponseEntity.noContent().build();
  }

  /** The path organization narrows the scope only when {@code organizationScope} is set. */
  private static SettingCoordinates coordinates(
      UUID organizationId, Long userId, Long teamId, Long projectId, boolean organizationScope) {
    return new SettingCoordinates(
        userId, teamId, projectId, organizationScope ? organizationId : null);
  }

  public record UpdateSettingRequest(@NotNull NotificationSettingValue value) {}

  public record SettingResponse(
      ExternalProvider provider, NotificationSettingType type, NotificationSettingValue value) {}
}
