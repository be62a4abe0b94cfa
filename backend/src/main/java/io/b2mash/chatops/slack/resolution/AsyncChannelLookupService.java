package io.b2mash.chatops.slack.resolution;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.chatops.config.AsyncConfig;
import io.b2mash.chatops.exception.DuplicateDisplayNameException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Background retry path for lookups that ran out of their inline budget. Each lookup runs with
 * the long budget on {@link AsyncConfig#CHANNEL_LOOKUP_EXECUTOR}; its status is kept for an hour
 * so the UI can poll it.
 */
@Service
public class AsyncChannelLookupService {

  private static final Logger log = LoggerFactory.getLogger(AsyncChannelLookupService.class);

  private static final Duration STATUS_TTL = Duration.ofHours(1);

  private final ChannelIdService channelIdService;
  private final TaskExecutor executor;
  private final Cache<UUID, ChannelLookupStatus> statuses;

  @Autowired
  public AsyncChannelLookupService(
      ChannelIdService channelIdService,
      @Qualifier(AsyncConfig.CHANNEL_LOOKUP_EXECUTOR) TaskExecutor executor) {
    this(channelIdService, executor, Ticker.systemTicker());
  }

  AsyncChannelLookupService(
      ChannelIdService channelIdService, TaskExecutor executor, Ticker ticker) {
    this.channelIdService = channelIdService;
    this.executor = executor;
    this.statuses =
        Caffeine.newBuilder()
            .expireAfterWrite(STATUS_TTL)
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
  }

  /**
   * Queues a lookup with the long time budget and returns its id for polling. A lookup the
   * executor rejects is recorded as {@code FAILED} under the returned id.
   */
  public UUID enqueue(UUID organizationId, UUID integrationId, String rawName) {
    var lookupId = UUID.randomUUID();
    statuses.put(lookupId, ChannelLookupStatus.pending(lookupId));
    log.info(
        "Queued background channel lookup: lookupId={}, integrationId={}, name={}",
        lookupId,
        integrationId,
        rawName);
    try {
      executor.execute(() -> runLookup(lookupId, organizationId, integrationId, rawName));
    } catch (TaskRejectedException e) {
      log.error(
          "Channel lookup queue full, lookup not started: lookupId={}, integrationId={}",
          lookupId,
          integrationId,
          e);
      statuses.put(
          lookupId,
          ChannelLookupStatus.of(
              lookupId, ChannelLookupStatus.State.FAILED, "Channel lookup queue full"));
    }
    return lookupId;
  }

  public Optional<ChannelLookupStatus> getStatus(UUID lookupId) {
    return Optional.ofNullable(statuses.getIfPresent(lookupId));
  }

  void runLookup(UUID lookupId, UUID organizationId, UUID integrationId, String rawName) {
    ChannelLookupStatus status;
    try {
      var lookup = channelIdService.resolveChannelId(organizationId, integrationId, rawName, true);
      if (lookup.found()) {
        status = ChannelLookupStatus.success(lookupId, lookup.prefix(), lookup.channelId());
      } else if (lookup.timedOut()) {
        status =
            ChannelLookupStatus.of(
                lookupId,
                ChannelLookupStatus.State.FAILED,
                "Timed out looking up '" + rawName + "'");
      } else {
        status =
            ChannelLookupStatus.of(
                lookupId,
                ChannelLookupStatus.State.NOT_FOUND,
                "Could not find channel or user '" + rawName + "'");
      }
    } catch (DuplicateDisplayNameException e) {
      status =
          ChannelLookupStatus.of(
              lookupId, ChannelLookupStatus.State.AMBIGUOUS, e.getBody().getDetail());
    } catch (RuntimeException e) {
      log.error(
          "Background channel lookup failed: lookupId={}, integrationId={}",
          lookupId,
          integrationId,
          e);
      status =
          ChannelLookupStatus.of(
              lookupId, ChannelLookupStatus.State.FAILED, "Channel lookup failed");
    }
    statuses.put(lookupId, status);
    log.info("Background channel lookup done: lookupId={}, state={}", lookupId, status.state());
  }
}
