package io.b2mash.chatops.integration.secret;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IntegrationSecretRepository extends JpaRepository<IntegrationSecret, UUID> {

  Optional<IntegrationSecret> findBySecretKey(String secretKey);

  @Modifying
  @Query("DELETE FROM IntegrationSecret s WHERE s.secretKey = :secretKey")
  int deleteBySecretKey(@Param("secretKey") String secretKey);
}
