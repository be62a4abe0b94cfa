package io.b2mash.chatops.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "notification_settings")
public class NotificationSetting {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "provider", nullable = false, length = 20)
  private ExternalProvider provider;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 30)
  private NotificationSettingType type;

  @Enumerated(EnumType.STRING)
  @Column(name = "scope_type", nullable = false, length = 20)
  private NotificationScopeType scopeType;

  @Column(name = "scope_identifier", nullable = false, length = 64)
  private String scopeIdentifier;

  @Enumerated(EnumType.STRING)
  @Column(name = "target_type", nullable = false, length = 20)
  private NotificationTargetType targetType;

  @Column(name = "target_identifier", nullable = false)
  private long targetIdentifier;

  @Enumerated(EnumType.STRING)
  @Column(name = "value", nullable = false, length = 30)
  private NotificationSettingValue value;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected NotificationSetting() {}

  public NotificationSetting(
      ExternalProvider provider,
      NotificationSettingType type,
      NotificationScope scope,
      NotificationTarget target,
      NotificationSettingValue value) {
    this.provider = provider;
    this.type = type;
    this.scopeType = scope.type();
    this.scopeIdentifier = scope.identifier();
    this.targetType = target.type();
    this.targetIdentifier = target.identifier();
    this.value = value;
    this.updatedAt = Instant.now();
  }

  public void changeValue(NotificationSettingValue value) {
    this.value = value;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public ExternalProvider getProvider() {
    return provider;
  }

  public NotificationSettingType getType() {
    return type;
  }

  public NotificationScopeType getScopeType() {
    return scopeType;
  }

  public String getScopeIdentifier() {
    return scopeIdentifier;
  }

  public NotificationTargetType getTargetType() {
    return targetType;
  }

  public long getTargetIdentifier() {
    return targetIdentifier;
  }

  public NotificationSettingValue getValue() {
    return value;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
