package io.b2mash.chatops.config;

import io.b2mash.chatops.slack.message.SlackColorPalette;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Attachment colors. Entries in {@code levels} override the built-in level table; the remaining
 * keys fall back to {@link SlackColorPalette#defaults()}.
 */
@ConfigurationProperties(prefix = "chatops.slack.colors")
public record SlackColorProperties(Map<String, String> levels, String resolved, String actioned) {

  public SlackColorPalette toPalette() {
    var defaults = SlackColorPalette.defaults();
    var merged = new LinkedHashMap<>(defaults.levelColors());
    if (levels != null) {
      merged.putAll(levels);
    }
    return new SlackColorPalette(
        merged,
        resolved != null ? resolved : defaults.resolvedColor(),
        actioned != null ? actioned : defaults.actionedColor());
  }
}
