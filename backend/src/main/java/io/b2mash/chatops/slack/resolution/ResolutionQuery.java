package io.b2mash.chatops.slack.resolution;

import io.b2mash.chatops.slack.client.SlackCredentials;
import java.time.Instant;
import java.util.Objects;

/**
 * Input of one name resolution.
 *
 * @param name requested name with leading {@code #}/{@code @} already stripped
 * @param deadline instant after which no further page is fetched
 */
public record ResolutionQuery(String name, Instant deadline, SlackCredentials credentials) {

  public ResolutionQuery {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(deadline, "deadline");
    Objects.requireNonNull(credentials, "credentials");
  }
}
