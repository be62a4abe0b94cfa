package io.b2mash.chatops.notification;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Derived queries treat a null project or organization argument as {@code IS NULL}. */
public interface LegacyUserOptionRepository extends JpaRepository<LegacyUserOption, UUID> {

  Optional<LegacyUserOption> findByUserIdAndProjectIdAndOrganizationIdAndKey(
      long userId, Long projectId, UUID organizationId, String key);

  long deleteByUserIdAndProjectIdAndKey(long userId, Long projectId, String key);

  long deleteByUserIdAndKeyIn(long userId, Collection<String> keys);
}
