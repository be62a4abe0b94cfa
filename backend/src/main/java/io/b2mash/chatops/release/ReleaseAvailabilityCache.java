package io.b2mash.chatops.release;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.chatops.exception.ForbiddenException;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers "does this project have any release" for attachment rendering. A project that has
 * releases keeps them, so positive answers are cached for an hour; negative answers only for a
 * minute so a first release shows up quickly.
 */
@Component
public class ReleaseAvailabilityCache {

  private static final Logger log = LoggerFactory.getLogger(ReleaseAvailabilityCache.class);

  static final Duration POSITIVE_TTL = Duration.ofHours(1);
  static final Duration NEGATIVE_TTL = Duration.ofSeconds(60);

  private final ProjectReleaseRepository releaseRepository;

  // "has_releases:<projectId>" -> answer
  private final Cache<String, Boolean> cache;

  @Autowired
  public ReleaseAvailabilityCache(ProjectReleaseRepository releaseRepository) {
    this(releaseRepository, Ticker.systemTicker());
  }

  ReleaseAvailabilityCache(ProjectReleaseRepository releaseRepository, Ticker ticker) {
    this.releaseRepository = releaseRepository;
    this.cache =
        Caffeine.newBuilder()
            .expireAfter(new AnswerExpiry())
            .maximumSize(50_000)
            .ticker(ticker)
            .build();
  }

  public boolean hasReleases(long projectId) {
    return cache.get(cacheKey(projectId), k -> releaseRepository.existsByProjectId(projectId));
  }

  /**
   * Records a release and drops a cached negative answer for the project. A project is owned by
   * the organization that recorded its first release.
   *
   * @throws ForbiddenException if the project's releases belong to another organization
   */
  @Transactional
  public void recordRelease(UUID organizationId, long projectId, String version) {
    if (releaseRepository.existsByProjectIdAndOrganizationIdNot(projectId, organizationId)) {
      log.warn(
          "Release rejected, project owned by another organization: projectId={}, orgId={}",
          projectId,
          organizationId);
      throw new ForbiddenException(
          "Project not accessible", "Project " + projectId + " belongs to another organization");
    }
    if (!releaseRepository.existsByProjectIdAndVersion(projectId, version)) {
      releaseRepository.save(new ProjectRelease(organizationId, projectId, version));
      log.debug("Recorded release: projectId={}, version={}", projectId, version);
    }
    cache.invalidate(cacheKey(projectId));
  }

  private static String cacheKey(long projectId) {
    return "has_releases:" + projectId;
  }

  private static final class AnswerExpiry implements Expiry<String, Boolean> {

    @Override
    public long expireAfterCreate(String key, Boolean hasReleases, long currentTime) {
      return ttl(hasReleases);
    }

    @Override
    public long expireAfterUpdate(
        String key, Boolean hasReleases, long currentTime, long currentDuration) {
      return ttl(hasReleases);
    }

    @Override
    public long expireAfterRead(
        String key, Boolean hasReleases, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private static long ttl(Boolean hasReleases) {
      return (Boolean.TRUE.equals(hasReleases) ? POSITIVE_TTL : NEGATIVE_TTL).toNanos();
    }
  }
}
