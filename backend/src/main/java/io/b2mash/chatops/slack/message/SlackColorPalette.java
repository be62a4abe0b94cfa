package io.b2mash.chatops.slack.message;

import java.util.Map;

/**
 * Attachment color table. Built once from configuration and passed to the attachment builders.
 *
 * @param levelColors event level ({@code debug} .. {@code fatal}) to hex color
 * @param resolvedColor color of resolved incidents
 * @param actionedColor color of issues someone already acted on from Slack
 */
public record SlackColorPalette(
    Map<String, String> levelColors, String resolvedColor, String actionedColor) {

  public static final String FALLBACK_LEVEL = "error";

  public SlackColorPalette {
    levelColors = Map.copyOf(levelColors);
    if (!levelColors.containsKey(FALLBACK_LEVEL)) {
      throw new IllegalArgumentException("Color palette must define the 'error' level");
    }
  }

  public static SlackColorPalette defaults() {
    return new SlackColorPalette(
        Map.of(
            "debug", "#fbe14f",
            "info", "#2788ce",
            "warning", "#FFC227",
            "error", "#E03E2F",
            "fatal", "#FA4747"),
        "#4dc771",
        "#EDEEEF");
  }

  /** Color for an event level; unknown or missing levels use the {@code error} color. */
  public String colorForLevel(String level) {
    if (level == null) {
      return levelColors.get(FALLBACK_LEVEL);
    }
    return levelColors.getOrDefault(level, levelColors.get(FALLBACK_LEVEL));
  }
}
