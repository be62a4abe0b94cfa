package io.b2mash.chatops.slack.message;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Absolute links back into the error-tracking web UI. */
@Component
public class PlatformUrls {

  private static final String REFERRER = "slack";

  private final String baseUrl;

  public PlatformUrls(@Value("${chatops.app.base-url:http://localhost:8000}") String baseUrl) {
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  public String issueUrl(String organizationSlug, long issueId, String eventId) {
    var path = "/organizations/" + organizationSlug + "/issues/" + issueId + "/";
    if (eventId != null) {
      path += "events/" + eventId + "/";
    }
    return baseUrl + path + "?referrer=" + REFERRER;
  }

  public String ruleUrl(String organizationSlug, String projectSlug, long ruleId) {
    return baseUrl
        + "/organizations/"
        + organizationSlug
        + "/alerts/rules/"
        + projectSlug
        + "/"
        + ruleId
        + "/";
  }

  public String incidentUrl(String organizationSlug, long identifier) {
    return baseUrl + "/organizations/" + organizationSlug + "/alerts/" + identifier + "/";
  }

  public String logoUrl() {
    return baseUrl + "/_static/sentry/images/sentry-email-avatar.png";
  }
}
