package io.b2mash.chatops.slack.message;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The parts of an event the attachment needs.
 *
 * @param eventType {@code error}, {@code csp}, {@code default}, ...
 * @param metadata type specific metadata, e.g. {@code type}/{@code value} for errors
 */
public record EventDetails(
    String eventId,
    String title,
    String eventType,
    Map<String, String> metadata,
    List<EventTag> tags,
    Instant datetime) {

  public EventDetails {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public String tag(String key) {
    return tags.stream()
        .filter(t -> t.key().equals(key))
        .map(EventTag::value)
        .findFirst()
        .orElse(null);
  }
}
