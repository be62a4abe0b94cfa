package io.b2mash.chatops.slack.client;

/**
 * Any failed call to the Slack Web API: transport fault, non-2xx status (auth, rate limit), or a
 * 200 response whose body carries {@code "ok": false}.
 */
public class SlackApiException extends RuntimeException {

  private final int statusCode;
  private final String error;

  public SlackApiException(int statusCode, String error, Throwable cause) {
    super(buildMessage(statusCode, error), cause);
    this.statusCode = statusCode;
    this.error = error;
  }

  public SlackApiException(int statusCode, String error) {
    this(statusCode, error, null);
  }

  /** HTTP status, or 0 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Slack error code (e.g. {@code invalid_auth}) or transport error description. */
  public String getError() {
    return error;
  }

  public boolean isRateLimited() {
    return statusCode == 429 || "ratelimited".equals(error);
  }

  private static String buildMessage(int statusCode, String error) {
    return statusCode > 0
        ? "Slack API error (HTTP " + statusCode + "): " + error
        : "Slack API request failed: " + error;
  }
}
