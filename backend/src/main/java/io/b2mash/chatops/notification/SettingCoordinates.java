package io.b2mash.chatops.notification;

import io.b2mash.chatops.exception.InvalidTargetException;
import java.util.UUID;

/**
 * Addresses one notification setting: exactly one target (user or team) plus an optional project
 * or organization narrowing the scope.
 */
public record SettingCoordinates(Long userId, Long teamId, Long projectId, UUID organizationId) {

  public static SettingCoordinates forUser(long userId) {
    return new SettingCoordinates(userId, null, null, null);
  }

  public static SettingCoordinates forTeam(long teamId) {
    return new SettingCoordinates(null, teamId, null, null);
  }

  public SettingCoordinates inProject(long projectId) {
    return new SettingCoordinates(userId, teamId, projectId, organizationId);
  }

  public SettingCoordinates inOrganization(UUID organizationId) {
    return new SettingCoordinates(userId, teamId, projectId, organizationId);
  }

  public NotificationTarget target() {
    if (userId != null && teamId != null) {
      throw new InvalidTargetException("A setting targets either a user or a team, not both");
    }
    if (userId != null) {
      return new NotificationTarget(NotificationTargetType.USER, userId);
    }
    if (teamId != null) {
      return new NotificationTarget(NotificationTargetType.TEAM, teamId);
    }
    throw new InvalidTargetException("Target must be either a user or a team");
  }

  /** Project wins over organization, organization over user. */
  public NotificationScope scope() {
    if (projectId != null) {
      return new NotificationScope(NotificationScopeType.PROJECT, projectId.toString());
    }
    if (organizationId != null) {
      return new NotificationScope(NotificationScopeType.ORGANIZATION, organizationId.toString());
    }
    if (userId != null) {
      return new NotificationScope(NotificationScopeType.USER, userId.toString());
    }
    throw new InvalidTargetException("Scope must be either a user, an organization or a project");
  }
}
