package io.b2mash.chatops.slack.resolution;

import io.b2mash.chatops.slack.client.SlackApiClient;
import io.b2mash.chatops.slack.client.SlackCredentials;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** {@link RemoteListClient} backed by {@code conversations.list} and {@code users.list}. */
@Component
public class SlackRemoteListClient implements RemoteListClient {

  private final SlackApiClient slackApiClient;

  public SlackRemoteListClient(SlackApiClient slackApiClient) {
    this.slackApiClient = slackApiClient;
  }

  @Override
  public ListPage fetch(
      SlackCredentials credentials, ListType listType, String cursor, int pageSize) {
    var params = new LinkedHashMap<String, Object>();
    params.put("exclude_archived", false);
    params.put("exclude_members", true);
    params.put("types", "public_channel,private_channel");
    params.put("limit", pageSize);
    if (cursor != null && !cursor.isEmpty()) {
      params.put("cursor", cursor);
    }

    var body =
        slackApiClient.get(
            listType.endpoint(), Map.of("Authorization", credentials.bearerHeader()), params);

    return new ListPage(parseItems(body.get(listType.getResultKey())), parseCursor(body));
  }

  private List<ListItem> parseItems(Object rawItems) {
    var items = new ArrayList<ListItem>();
    if (!(rawItems instanceof List<?> list)) {
      return items;
    }
    for (Object raw : list) {
      if (raw instanceof Map<?, ?> item) {
        items.add(
            new ListItem(
                stringValue(item.get("id")),
                stringValue(item.get("name")),
                displayName(item.get("profile"))));
      }
    }
    return items;
  }

  private static String displayName(Object profile) {
    if (profile instanceof Map<?, ?> map) {
      return stringValue(map.get("display_name"));
    }
    return null;
  }

  private static String parseCursor(Map<String, Object> body) {
    if (body.get("response_metadata") instanceof Map<?, ?> metadata) {
      return stringValue(metadata.get("next_cursor"));
    }
    return null;
  }

  private static String stringValue(Object value) {
    return value != null ? value.toString() : null;
  }
}
