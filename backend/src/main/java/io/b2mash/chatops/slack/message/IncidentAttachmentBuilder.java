package io.b2mash.chatops.slack.message;

import java.util.List;
import org.springframework.stereotype.Component;

/** Builds the attachment posted when a metric alert changes state. */
@Component
public class IncidentAttachmentBuilder {

  private final SlackColorPalette palette;
  private final PlatformUrls urls;

  public IncidentAttachmentBuilder(SlackColorPalette palette, PlatformUrls urls) {
    this.palette = palette;
    this.urls = urls;
  }

  /**
   * @param metricValue value that triggered the alert; falls back to the incident's current value
   */
  public SlackAttachment build(IncidentSummary incident, Double metricValue) {
    var title = incident.status().getLabel() + ": " + incident.alertRuleName();
    var value = metricValue != null ? metricValue : incident.currentMetricValue();
    var text =
        formatMetric(value)
            + " "
            + incident.aggregate()
            + " in the last "
            + incident.timeWindowMinutes()
            + " minutes";

    // Slack renders the date in the reader's timezone
    var footer =
        "<!date^"
            + incident.dateStarted().getEpochSecond()
            + "^Sentry Incident - Started {date_pretty} at {time} | Sentry Incident>";

    return new SlackAttachment(
        title,
        title,
        urls.incidentUrl(incident.organizationSlug(), incident.identifier()),
        text,
        List.of(),
        List.of("text"),
        null,
        urls.logoUrl(),
        footer,
        null,
        colorFor(incident.status()),
        List.of());
  }

  private String colorFor(IncidentStatus status) {
    return switch (status) {
      case RESOLVED -> palette.resolvedColor();
      case WARNING -> palette.colorForLevel("warning");
      case CRITICAL -> palette.colorForLevel("fatal");
    };
  }

  static String formatMetric(Double value) {
    if (value == null) {
      return "";
    }
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return Long.toString(value.longValue());
    }
    return value.toString();
  }
}
