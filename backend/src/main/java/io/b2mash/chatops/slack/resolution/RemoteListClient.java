package io.b2mash.chatops.slack.resolution;

import io.b2mash.chatops.slack.client.SlackApiException;
import io.b2mash.chatops.slack.client.SlackCredentials;

/** Fetches Slack listings one page per call. */
public interface RemoteListClient {

  /**
   * Fetches one page.
   *
   * @param cursor continuation cursor from the previous page, empty for the first page
   * @throws SlackApiException on any transport, auth or rate limit failure; callers must not
   *     expect a retry
   */
  ListPage fetch(SlackCredentials credentials, ListType listType, String cursor, int pageSize);
}
