package io.b2mash.chatops.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

/** Row of the legacy per-user key/value option store mirrored on every settings write. */
@Entity
@Table(name = "user_options")
public class LegacyUserOption {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private long userId;

  @Column(name = "project_id")
  private Long projectId;

  @Column(name = "organization_id")
  private UUID organizationId;

  @Column(name = "option_key", nullable = false, length = 64)
  private String key;

  @Column(name = "option_value", nullable = false, length = 64)
  private String value;

  protected LegacyUserOption() {}

  public LegacyUserOption(
      long userId, Long projectId, UUID organizationId, String key, String value) {
    this.userId = userId;
    this.projectId = projectId;
    this.organizationId = organizationId;
    this.key = key;
    this.value = value;
  }

  public UUID getId() {
    return id;
  }

  public long getUserId() {
    return userId;
  }

  public Long getProjectId() {
    return projectId;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }
}
