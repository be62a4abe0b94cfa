package io.b2mash.chatops.slack.client;

/** Bot token of an installed workspace. */
public record SlackCredentials(String accessToken) {

  public SlackCredentials {
    if (accessToken == null || accessToken.isBlank()) {
      throw new IllegalArgumentException("accessToken must not be blank");
    }
  }

  public String bearerHeader() {
    return "Bearer " + accessToken;
  }

  @Override
  public String toString() {
    return "SlackCredentials[accessToken=***]";
  }
}
