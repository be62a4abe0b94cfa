package io.b2mash.chatops.slack.resolution;

import io.b2mash.chatops.config.SlackProperties;
import io.b2mash.chatops.slack.client.SlackCredentials;
import java.time.Clock;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Picks the time budget for a lookup. Inline lookups get the short budget so request threads are
 * not held by workspaces with many channels; lookups already running in a background job get the
 * long one.
 *
 * <p>A {@link ResolutionResult.Status#TIMED_OUT} result from an inline lookup means the caller has
 * to retry in the background instead of failing.
 */
@Component
public class ResolutionScheduler {

  private static final String STRIP_CHARS = "#@";

  private final NameResolver nameResolver;
  private final Clock clock;
  private final Duration syncTimeout;
  private final Duration asyncTimeout;

  public ResolutionScheduler(NameResolver nameResolver, Clock clock, SlackProperties properties) {
    this.nameResolver = nameResolver;
    this.clock = clock;
    this.syncTimeout = properties.syncLookupTimeout();
    this.asyncTimeout = properties.asyncLookupTimeout();
  }

  public ResolutionResult resolveChannel(
      String rawName, SlackCredentials credentials, boolean isAsyncContext) {
    var timeout = isAsyncContext ? asyncTimeout : syncTimeout;
    var deadline = clock.instant().plus(timeout);
    return nameResolver.resolve(
        new ResolutionQuery(stripChannelName(rawName), deadline, credentials));
  }

  /** Removes every leading {@code #} and {@code @}. */
  public static String stripChannelName(String name) {
    int start = 0;
    while (start < name.length() && STRIP_CHARS.indexOf(name.charAt(start)) >= 0) {
      start++;
    }
    return name.substring(start);
  }
}
