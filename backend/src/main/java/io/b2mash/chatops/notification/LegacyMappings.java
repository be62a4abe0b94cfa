package io.b2mash.chatops.notification;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translation to the legacy {@code user_options} key/value rows that older readers still consume.
 * A value without a legacy encoding is not valid for its type.
 */
public final class LegacyMappings {

  /** Legacy key used for issue alert settings that are not tied to a project. */
  public static final String SUBSCRIBE_BY_DEFAULT_KEY = "subscribe_by_default";

  private static final Map<NotificationSettingType, String> LEGACY_KEYS =
      Map.of(
          NotificationSettingType.DEPLOY, "deploy-emails",
          NotificationSettingType.ISSUE_ALERTS, "mail:alert",
          NotificationSettingType.WORKFLOW, "workflow:notifications");

  private static final Map<NotificationSettingType, Map<NotificationSettingValue, String>>
      LEGACY_VALUES =
          Map.of(
              NotificationSettingType.DEPLOY,
              Map.of(
                  NotificationSettingValue.ALWAYS, "2",
                  NotificationSettingValue.NEVER, "4",
                  NotificationSettingValue.COMMITTED_ONLY, "3"),
              NotificationSettingType.ISSUE_ALERTS,
              Map.of(
                  NotificationSettingValue.ALWAYS, "1",
                  NotificationSettingValue.NEVER, "0"),
              NotificationSettingType.WORKFLOW,
              Map.of(
                  NotificationSettingValue.ALWAYS, "0",
                  NotificationSettingValue.NEVER, "2",
                  NotificationSettingValue.SUBSCRIBE_ONLY, "1"));

  private LegacyMappings() {}

  public static Optional<String> legacyKey(NotificationSettingType type) {
    return Optional.ofNullable(LEGACY_KEYS.get(type));
  }

  /** Key a setting is mirrored under; issue alerts without a project use the global flag. */
  public static Optional<String> legacyKey(NotificationSettingType type, Long projectId) {
    if (type == NotificationSettingType.ISSUE_ALERTS && projectId == null) {
      return Optional.of(SUBSCRIBE_BY_DEFAULT_KEY);
    }
    return legacyKey(type);
  }

  public static Optional<String> legacyValue(
      NotificationSettingType type, NotificationSettingValue value) {
    return Optional.ofNullable(LEGACY_VALUES.getOrDefault(type, Map.of()).get(value));
  }

  public static boolean isValid(NotificationSettingType type, NotificationSettingValue value) {
    return legacyValue(type, value).isPresent();
  }

  /** Every key a setting of this type may be mirrored under. */
  public static Collection<String> allLegacyKeys(NotificationSettingType type) {
    if (type == NotificationSettingType.ISSUE_ALERTS) {
      return List.of(LEGACY_KEYS.get(type), SUBSCRIBE_BY_DEFAULT_KEY);
    }
    return legacyKey(type).map(List::of).orElse(List.of());
  }

  public static Collection<String> allLegacyKeys() {
    var keys = new ArrayList<>(LEGACY_KEYS.values());
    keys.add(SUBSCRIBE_BY_DEFAULT_KEY);
    return keys;
  }
}
