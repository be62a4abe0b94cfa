package io.b2mash.chatops.slack.message;

/** Metric-alert incident state as shown in attachment titles. */
public enum IncidentStatus {
  RESOLVED("Resolved"),
  WARNING("Warning"),
  CRITICAL("Critical");

  private final String label;

  IncidentStatus(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
