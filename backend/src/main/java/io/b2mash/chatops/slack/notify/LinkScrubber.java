package io.b2mash.chatops.slack.notify;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Strips identifiers out of platform links so they can be aggregated, e.g. {@code
 * /organizations/acme/issues/42/?project=7} becomes {@code
 * organizations/{organization}/issues/{issue_id}/project=%7Bproject%7D}.
 */
public final class LinkScrubber {

  private static final Map<String, String> SCRUBBED_SEGMENTS =
      Map.of(
          "organizations", "{organization}",
          "issues", "{issue_id}",
          "events", "{event_id}");

  private static final String PROJECT_PARAM = "project";

  private LinkScrubber() {}

  public static String parseLink(String url) {
    var uri = URI.create(url);

    var path = uri.getRawPath() == null ? "" : trimSlashes(uri.getRawPath());
    var segments = new ArrayList<>(Arrays.asList(path.split("/", -1)));
    for (int i = 0; i < segments.size() - 1; i++) {
      var replacement = SCRUBBED_SEGMENTS.get(segments.get(i));
      if (replacement != null) {
        segments.set(i + 1, replacement);
      }
    }

    return String.join("/", segments) + "/" + scrubQuery(uri.getRawQuery());
  }

  private static String scrubQuery(String rawQuery) {
    if (rawQuery == null || rawQuery.isEmpty()) {
      return "";
    }
    List<String> pairs = new ArrayList<>();
    for (var pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      var parts = pair.split("=", 2);
      var name = decode(parts[0]);
      var value = parts.length > 1 ? decode(parts[1]) : "";
      if (PROJECT_PARAM.equals(name)) {
        value = "{project}";
      }
      pairs.add(encode(name) + "=" + encode(value));
    }
    return String.join("&", pairs);
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String trimSlashes(String path) {
    int start = 0;
    int end = path.length();
    while (start < end && path.charAt(start) == '/') {
      start++;
    }
    while (end > start && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(start, end);
  }
}
