package io.b2mash.chatops.slack.resolution;

/**
 * Outcome of a name resolution. An ambiguous display name is not a result: it is raised as {@link
 * io.b2mash.chatops.exception.DuplicateDisplayNameException}.
 *
 * @param prefix {@code #} or {@code @}; for {@link Status#NOT_FOUND} and {@link Status#TIMED_OUT}
 *     it is the prefix of the list type that was being searched last
 * @param channelId Slack id of the match, only set when {@link Status#FOUND}
 */
public record ResolutionResult(Status status, String prefix, String channelId) {

  public enum Status {
    FOUND,
    NOT_FOUND,
    TIMED_OUT
  }

  public static ResolutionResult found(String prefix, String channelId) {
    return new ResolutionResult(Status.FOUND, prefix, channelId);
  }

  public static ResolutionResult notFound(String prefix) {
    return new ResolutionResult(Status.NOT_FOUND, prefix, null);
  }

  public static ResolutionResult timedOut(String prefix) {
    return new ResolutionResult(Status.TIMED_OUT, prefix, null);
  }

  public boolean isFound() {
    return status == Status.FOUND;
  }

  public boolean isTimedOut() {
    return status == Status.TIMED_OUT;
  }
}
