package io.b2mash.chatops.slack.resolution;

import java.util.UUID;

/** Progress of a background channel lookup. */
public record ChannelLookupStatus(
    UUID lookupId, State state, String prefix, String channelId, String detail) {

  public enum State {
    PENDING,
    SUCCESS,
    NOT_FOUND,
    AMBIGUOUS,
    FAILED
  }

  static ChannelLookupStatus pending(UUID lookupId) {
    return new ChannelLookupStatus(lookupId, State.PENDING, null, null, null);
  }

  static ChannelLookupStatus success(UUID lookupId, String prefix, String channelId) {
    return new ChannelLookupStatus(lookupId, State.SUCCESS, prefix, channelId, null);
  }

  static ChannelLookupStatus of(UUID lookupId, State state, String detail) {
    return new ChannelLookupStatus(lookupId, state, null, null, detail);
  }
}
