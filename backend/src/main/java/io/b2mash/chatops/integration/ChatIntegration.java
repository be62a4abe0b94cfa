package io.b2mash.chatops.integration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/** A chat workspace installed for an organization. The access token lives in the secret store. */
@Entity
@Table(name = "chat_integrations")
public class ChatIntegration {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false)
  private UUID organizationId;

  @Column(name = "provider", nullable = false, length = 30)
  private String provider;

  @Column(name = "external_id", nullable = false, length = 64)
  private String externalId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "installation_type", nullable = false, length = 30)
  private InstallationType installationType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private IntegrationStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version private Long version;

  protected ChatIntegration() {}

  public ChatIntegration(
      UUID organizationId,
      String provider,
      String externalId,
      String name,
      InstallationType installationType) {
    this.organizationId = organizationId;
    this.provider = provider;
    this.externalId = externalId;
    this.name = name;
    this.installationType = installationType;
    this.status = IntegrationStatus.ACTIVE;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void rename(String name) {
    this.name = name;
  }

  public void activate() {
    this.status = IntegrationStatus.ACTIVE;
  }

  public void disable() {
    this.status = IntegrationStatus.DISABLED;
  }

  public boolean isActive() {
    return status == IntegrationStatus.ACTIVE;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getProvider() {
    return provider;
  }

  public String getExternalId() {
    return externalId;
  }

  public String getName() {
    return name;
  }

  public InstallationType getInstallationType() {
    return installationType;
  }

  public IntegrationStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
