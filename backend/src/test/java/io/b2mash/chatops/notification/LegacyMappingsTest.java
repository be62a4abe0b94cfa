package io.b2mash.chatops.notification;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LegacyMappingsTest {

  @Test
  void deploy_values_map_to_legacy_codes() {
    assertThat(LegacyMappings.legacyValue(NotificationSettingType.DEPLOY, NotificationSettingValue.ALWAYS))
        .contains("2");
    assertThat(LegacyMappings.legacyValue(NotificationSettingType.DEPLOY, NotificationSettingValue.NEVER))
        .contains("4");
    assertThat(
            LegacyMappings.legacyValue(
                NotificationSettingType.DEPLOY, NotificationSettingValue.COMMITTED_ONLY))
        .contains("3");
  }

  @Test
  void workflow_supports_subscribe_only() {
    assertThat(
            LegacyMappings.legacyValue(
                NotificationSettingType.WORKFLOW, NotificationSettingValue.SUBSCRIBE_ONLY))
        .contains("1");
    assertThat(
            LegacyMappings.isValid(
                NotificationSettingType.WORKFLOW, NotificationSettingValue.COMMITTED_ONLY))
        .isFalse();
  }

  @Test
  void issue_alerts_only_accept_always_and_never() {
    assertThat(
            LegacyMappings.isValid(
                NotificationSettingType.ISSUE_ALERTS, NotificationSettingValue.ALWAYS))
        .isTrue();
    assertThat(
            LegacyMappings.isValid(
                NotificationSettingType.ISSUE_ALERTS, NotificationSettingValue.SUBSCRIBE_ONLY))
        .isFalse();
  }

  @Test
  void default_type_has_no_legacy_encoding() {
    assertThat(LegacyMappings.legacyKey(NotificationSettingType.DEFAULT)).isEmpty();
    assertThat(
            LegacyMappings.isValid(
                NotificationSettingType.DEFAULT, NotificationSettingValue.ALWAYS))
        .isFalse();
  }

  @Test
  void issue_alerts_without_project_use_subscribe_by_default() {
    assertThat(LegacyMappings.legacyKey(NotificationSettingType.ISSUE_ALERTS, null))
        .contains("subscribe_by_default");
    assertThat(LegacyMappings.legacyKey(NotificationSettingType.ISSUE_ALERTS, 7L))
        .contains("mail:alert");
    assertThat(LegacyMappings.legacyKey(NotificationSettingType.DEPLOY, null))
        .contains("deploy-emails");
  }

  @Test
  void all_keys_cover_the_global_issue_alert_flag() {
    assertThat(LegacyMappings.allLegacyKeys())
        .containsExactlyInAnyOrder(
            "deploy-emails", "mail:alert", "workflow:notifications", "subscribe_by_default");
    assertThat(LegacyMappings.allLegacyKeys(NotificationSettingType.ISSUE_ALERTS))
        .containsExactlyInAnyOrder("mail:alert", "subscribe_by_default");
  }
}
