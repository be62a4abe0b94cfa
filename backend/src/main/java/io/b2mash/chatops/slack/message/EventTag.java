package io.b2mash.chatops.slack.message;

/** Tag as stored on an event. Internal keys carry a {@code sentry:} prefix. */
public record EventTag(String key, String value) {

  private static final String INTERNAL_PREFIX = "sentry:";

  /** Key as shown to users, without the internal prefix. */
  public String standardizedKey() {
    return key.startsWith(INTERNAL_PREFIX) ? key.substring(INTERNAL_PREFIX.length()) : key;
  }
}
