package io.b2mash.chatops.release;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Local projection of releases known for a project. */
@Entity
@Table(name = "project_releases")
public class ProjectRelease {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "project_id", nullable = false)
  private long projectId;

  @Column(name = "version", nullable = false, length = 250)
  private String version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ProjectRelease() {}

  public ProjectRelease(UUID organizationId, long projectId, String version) {
    this.organizationId = organizationId;
    this.projectId = projectId;
    this.version = version;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public long getProjectId() {
    return projectId;
  }

  public String getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
