package io.b2mash.chatops.notification;

import io.b2mash.chatops.exception.InvalidStateException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and writes per-target notification settings. A missing row reads as {@link
 * NotificationSettingValue#DEFAULT}, and writing {@code DEFAULT} removes the row.
 */
@Service
public class NotificationSettingsService {

  private static final Logger log = LoggerFactory.getLogger(NotificationSettingsService.class);

  private final NotificationSettingRepository settingRepository;
  private final LegacyUserOptionRepository userOptionRepository;
  private final NotificationSettingWriter writer;

  public NotificationSettingsService(
      NotificationSettingRepository settingRepository,
      LegacyUserOptionRepository userOptionRepository,
      NotificationSettingWriter writer) {
    this.settingRepository = settingRepository;
    this.userOptionRepository = userOptionRepository;
    this.writer = writer;
  }

  @Transactional(readOnly = true)
  public NotificationSettingValue getSetting(
      ExternalProvider provider, NotificationSettingType type, SettingCoordinates coordinates) {
    var scope = coordinates.scope();
    var target = coordinates.target();
    return settingRepository
        .findSetting(
            provider, type, scope.type(), scope.identifier(), target.type(), target.identifier())
        .map(NotificationSetting::getValue)
        .orElse(NotificationSettingValue.DEFAULT);
  }

  public void updateSetting(
      ExternalProvider provider,
      NotificationSettingType type,
      NotificationSettingValue value,
      SettingCoordinates coordinates) {
    if (value == NotificationSettingValue.DEFAULT) {
      removeSetting(provider, type, coordinates);
      return;
    }

    var legacyValue =
        LegacyMappings.legacyValue(type, value)
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Invalid notification setting",
                        "Value " + value + " is not valid for type " + type));
    // a value is only valid when its type has a legacy key
    var legacyKey = LegacyMappings.legacyKey(type, coordinates.projectId()).orElseThrow();

    writer.write(provider, type, value, coordinates, legacyKey, legacyValue);
  }

  public void removeSetting(
      ExternalProvider provider, NotificationSettingType type, SettingCoordinates coordinates) {
    var legacyKey = LegacyMappings.legacyKey(type, coordinates.projectId()).orElse(null);
    writer.delete(provider, type, coordinates, legacyKey);
  }

  /** Removes a user's settings of one type, or of every type when {@code type} is null. */
  @Transactional
  public void removeSettingsForUser(long userId, NotificationSettingType type) {
    int removed;
    if (type != null) {
      userOptionRepository.deleteByUserIdAndKeyIn(userId, LegacyMappings.allLegacyKeys(type));
      removed = settingRepository.deleteByTargetAndType(NotificationTargetType.USER, userId, type);
    } else {
      userOptionRepository.deleteByUserIdAndKeyIn(userId, LegacyMappings.allLegacyKeys());
      removed = settingRepository.deleteByTarget(NotificationTargetType.USER, userId);
    }
    log.info("Removed notification settings: userId={}, type={}, count={}", userId, type, removed);
  }

  /** Project-level settings of several users. Users without a stored setting are absent. */
  @Transactional(readOnly = true)
  public Map<Long, NotificationSettingValue> getSettingsForUsers(
      ExternalProvider provider,
      NotificationSettingType type,
      Collection<Long> userIds,
      long projectId) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    var result = new HashMap<Long, NotificationSettingValue>();
    for (var setting :
        settingRepository.findForTargets(
            provider,
            type,
            NotificationScopeType.PROJECT,
            Long.toString(projectId),
            NotificationTargetType.USER,
            userIds)) {
      result.put(setting.getTargetIdentifier(), setting.getValue());
    }
    return result;
  }
}
