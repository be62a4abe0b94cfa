package io.b2mash.chatops.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the Slack integration.
 *
 * @param baseUrl Web API root, e.g. {@code https://slack.com/api}
 * @param syncLookupTimeout time budget for a channel lookup done inline with a user request
 * @param asyncLookupTimeout time budget for a channel lookup running in a background job
 * @param listPageSize page size for {@code *.list} calls, at most 1000
 * @param postTimeout read timeout for {@code chat.postMessage}
 */
@ConfigurationProperties(prefix = "chatops.slack")
public record SlackProperties(
    String baseUrl,
    Duration syncLookupTimeout,
    Duration asyncLookupTimeout,
    int listPageSize,
    Duration postTimeout) {

  static final int MAX_LIST_PAGE_SIZE = 1000;

  public SlackProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      baseUrl = "https://slack.com/api";
    }
    if (syncLookupTimeout == null) {
      syncLookupTimeout = Duration.ofSeconds(10);
    }
    if (asyncLookupTimeout == null) {
      asyncLookupTimeout = Duration.ofMinutes(3);
    }
    if (listPageSize <= 0 || listPageSize > MAX_LIST_PAGE_SIZE) {
      listPageSize = MAX_LIST_PAGE_SIZE;
    }
    if (postTimeout == null) {
      postTimeout = Duration.ofSeconds(5);
    }
  }

  public static SlackProperties defaults() {
    return new SlackProperties(null, null, null, 0, null);
  }
}
