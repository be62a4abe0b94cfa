package io.b2mash.chatops.slack.resolution;

import java.util.List;

/** One page of a Slack listing. A null or empty cursor marks the last page. */
public record ListPage(List<ListItem> items, String nextCursor) {

  public ListPage {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public boolean hasMore() {
    return nextCursor != null && !nextCursor.isEmpty();
  }
}
