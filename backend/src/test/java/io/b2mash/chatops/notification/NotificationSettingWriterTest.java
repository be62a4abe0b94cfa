package io.b2mash.chatops.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationSettingWriterTest {

  private static final UUID ORG_ID = UUID.fromString("11111111-2222-3333-4444-555555555555");

  @Mock private NotificationSettingRepository settingRepository;
  @Mock private LegacyUserOptionRepository userOptionRepository;

  @InjectMocks private NotificationSettingWriter writer;

  @Test
  void new_user_setting_writes_both_rows() {
    var coordinates = SettingCoordinates.forUser(5L).inProject(9L);
    when(settingRepository.findSetting(
            ExternalProvider.EMAIL,
            NotificationSettingType.DEPLOY,
            NotificationScopeType.PROJECT,
            "9",
            NotificationTargetType.USER,
            5L))
        .thenReturn(Optional.empty());
    when(userOptionRepository.findByUserIdAndProjectIdAndOrganizationIdAndKey(
            5L, 9L, null, "deploy-emails"))
        .thenReturn(Optional.empty());

    writer.write(
        ExternalProvider.EMAIL,
        NotificationSettingType.DEPLOY,
        NotificationSettingValue.NEVER,
        coordinates,
        "deploy-emails",
        "4");

    var setting = ArgumentCaptor.forClass(NotificationSetting.class);
    verify(settingRepository).save(setting.capture());
    assertThat(setting.getValue().getValue()).isEqualTo(NotificationSettingValue.NEVER);
    assertThat(setting.getValue().getScopeIdentifier()).isEqualTo("9");

    var option = ArgumentCaptor.forClass(LegacyUserOption.class);
    verify(userOptionRepository).save(option.capture());
    assertThat(option.getValue().getKey()).isEqualTo("deploy-emails");
    assertThat(option.getValue().getValue()).isEqualTo("4");
    assertThat(option.getValue().getProjectId()).isEqualTo(9L);
  }

  @Test
  void existing_rows_are_updated_in_place() {
    var coordinates = SettingCoordinates.forUser(5L).inOrganization(ORG_ID);
    var scope = coordinates.scope();
    var existing =
        new NotificationSetting(
            ExternalProvider.EMAIL,
            NotificationSettingType.WORKFLOW,
            scope,
            coordinates.target(),
            NotificationSettingValue.ALWAYS);
    var option = new LegacyUserOption(5L, null, ORG_ID, "workflow:notifications", "0");
    when(settingRepository.findSetting(
            ExternalProvider.EMAIL,
            NotificationSettingType.WORKFLOW,
            NotificationScopeType.ORGANIZATION,
            ORG_ID.toString(),
            NotificationTargetType.USER,
            5L))
        .thenReturn(Optional.of(existing));
    when(userOptionRepository.findByUserIdAndProjectIdAndOrganizationIdAndKey(
            5L, null, ORG_ID, "workflow:notifications"))
        .thenReturn(Optional.of(option));

    writer.write(
        ExternalProvider.EMAIL,
        NotificationSettingType.WORKFLOW,
        NotificationSettingValue.SUBSCRIBE_ONLY,
        coordinates,
        "workflow:notifications",
        "1");

    assertThat(existing.getValue()).isEqualTo(NotificationSettingValue.SUBSCRIBE_ONLY);
    assertThat(option.getValue()).isEqualTo("1");
    verify(settingRepository, never()).save(any());
    verify(userOptionRepository, never()).save(any());
  }

  @Test
  void team_setting_has_no_legacy_mirror() {
    var coordinates = SettingCoordinates.forTeam(3L).inProject(9L);
    when(settingRepository.findSetting(
            ExternalProvider.SLACK,
            NotificationSettingType.ISSUE_ALERTS,
            NotificationScopeType.PROJECT,
            "9",
            NotificationTargetType.TEAM,
            3L))
        .thenReturn(Optional.empty());

    writer.write(
        ExternalProvider.SLACK,
        NotificationSettingType.ISSUE_ALERTS,
        NotificationSettingValue.ALWAYS,
        coordinates,
        "mail:alert",
        "1");

    verify(settingRepository).save(any(NotificationSetting.class));
    verifyNoInteractions(userOptionRepository);
  }

  @Test
  void delete_removes_setting_and_legacy_row() {
    var coordinates = SettingCoordinates.forUser(5L);
    var existing =
        new NotificationSetting(
            ExternalProvider.EMAIL,
            NotificationSettingType.DEPLOY,
            coordinates.scope(),
            coordinates.target(),
            NotificationSettingValue.ALWAYS);
    when(settingRepository.findSetting(
            ExternalProvider.EMAIL,
            NotificationSettingType.DEPLOY,
            NotificationScopeType.USER,
            "5",
            NotificationTargetType.USER,
            5L))
        .thenReturn(Optional.of(existing));

    writer.delete(
        ExternalProvider.EMAIL, NotificationSettingType.DEPLOY, coordinates, "deploy-emails");

    verify(settingRepository).delete(existing);
    verify(userOptionRepository).deleteByUserIdAndProjectIdAndKey(5L, null, "deploy-emails");
  }

  @Test
  void delete_without_legacy_key_skips_mirror() {
    var coordinates = SettingCoordinates.forUser(5L);
    when(settingRepository.findSetting(any(), any(), any(), anyString(), any(), anyLong()))
        .thenReturn(Optional.empty());

    writer.delete(ExternalProvider.EMAIL, NotificationSettingType.DEFAULT, coordinates, null);

    verifyNoInteractions(userOptionRepository);
  }
}
