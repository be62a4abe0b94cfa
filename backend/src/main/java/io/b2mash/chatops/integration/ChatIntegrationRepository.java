package io.b2mash.chatops.integration;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatIntegrationRepository extends JpaRepository<ChatIntegration, UUID> {

  @Query(
      """
      SELECT ci FROM ChatIntegration ci
      WHERE ci.id = :id
        AND ci.organizationId = :organizationId
        AND ci.status = :status
      """)
  Optional<ChatIntegration> findByIdAndOrganizationIdAndStatus(
      @Param("id") UUID id,
      @Param("organizationId") UUID organizationId,
      @Param("status") IntegrationStatus status);

  Optional<ChatIntegration> findByOrganizationIdAndProviderAndExternalId(
      UUID organizationId, String provider, String externalId);
}
