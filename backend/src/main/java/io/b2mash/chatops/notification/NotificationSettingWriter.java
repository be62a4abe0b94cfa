package io.b2mash.chatops.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a setting row and its legacy {@code user_options} mirror as one unit of work. Either both
 * rows change or neither does. Only user targets have a legacy mirror.
 */
@Component
public class NotificationSettingWriter {

  private static final Logger log = LoggerFactory.getLogger(NotificationSettingWriter.class);

  private final NotificationSettingRepository settingRepository;
  private final LegacyUserOptionRepository userOptionRepository;

  public NotificationSettingWriter(
      NotificationSettingRepository settingRepository,
      LegacyUserOptionRepository userOptionRepository) {
    this.settingRepository = settingRepository;
    this.userOptionRepository = userOptionRepository;
  }

  @Transactional
  public void write(
      ExternalProvider provider,
      NotificationSettingType type,
      NotificationSettingValue value,
      SettingCoordinates coordinates,
      String legacyKey,
      String legacyValue) {
    var scope = coordinates.scope();
    var target = coordinates.target();

    var setting =
        settingRepository
            .findSetting(
                provider,
                type,
                scope.type(),
                scope.identifier(),
                target.type(),
                target.identifier())
            .orElse(null);
    if (setting == null) {
      settingRepository.save(new NotificationSetting(provider, type, scope, target, value));
    } else if (setting.getValue() != value) {
      setting.changeValue(value);
    }

    if (target.type() == NotificationTargetType.USER) {
      var option =
          userOptionRepository
              .findByUserIdAndProjectIdAndOrganizationIdAndKey(
                  target.identifier(),
                  coordinates.projectId(),
                  coordinates.organizationId(),
                  legacyKey)
              .orElse(null);
      if (option == null) {
        userOptionRepository.save(
            new LegacyUserOption(
                target.identifier(),
                coordinates.projectId(),
                coordinates.organizationId(),
                legacyKey,
                legacyValue));
      } else {
        option.setValue(legacyValue);
      }
    }

    log.debug(
        "Wrote notification setting: provider={}, type={}, scope={}:{}, target={}:{}, value={}",
        provider,
        type,
        scope.type(),
        scope.identifier(),
        target.type(),
        target.identifier(),
        value);
  }

  @Transactional
  public void delete(
      ExternalProvider provider,
      NotificationSettingType type,
      SettingCoordinates coordinates,
      String legacyKey) {
    var scope = coordinates.scope();
    var target = coordinates.target();

    settingRepository
        .findSetting(
            provider, type, scope.type(), scope.identifier(), target.type(), target.identifier())
        .ifPresent(settingRepository::delete);

    if (target.type() == NotificationTargetType.USER && legacyKey != null) {
      userOptionRepository.deleteByUserIdAndProjectIdAndKey(
          target.identifier(), coordinates.projectId(), legacyKey);
    }
  }
}
