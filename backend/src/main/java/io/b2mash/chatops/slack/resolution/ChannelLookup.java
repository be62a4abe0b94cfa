package io.b2mash.chatops.slack.resolution;

/**
 * Result handed to alert-rule flows.
 *
 * @param channelId null when not found or timed out
 * @param timedOut whether the self-imposed time budget ran out before the name was found
 */
public record ChannelLookup(String prefix, String channelId, boolean timedOut) {

  static ChannelLookup from(ResolutionResult result) {
    return new ChannelLookup(result.prefix(), result.channelId(), result.isTimedOut());
  }

  public boolean found() {
    return channelId != null;
  }
}
