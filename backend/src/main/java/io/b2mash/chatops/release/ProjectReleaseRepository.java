package io.b2mash.chatops.release;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectReleaseRepository extends JpaRepository<ProjectRelease, UUID> {

  boolean existsByProjectId(long projectId);

  boolean existsByProjectIdAndVersion(long projectId, String version);

  /** True when the project's releases were recorded under a different organization. */
  boolean existsByProjectIdAndOrganizationIdNot(long projectId, UUID organizationId);
}
