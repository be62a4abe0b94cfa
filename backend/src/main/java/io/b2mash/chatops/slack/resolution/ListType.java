package io.b2mash.chatops.slack.resolution;

import java.util.List;

/**
 * The Slack listings searched when resolving a name, with the JSON key holding each page's items
 * and the display prefix of a match.
 */
public enum ListType {
  CONVERSATIONS("conversations", "channels", "#"),
  USERS("users", "members", "@");

  /** Search order: channels are always exhausted before users. */
  public static final List<ListType> SEARCH_ORDER = List.of(CONVERSATIONS, USERS);

  private final String listName;
  private final String resultKey;
  private final String prefix;

  ListType(String listName, String resultKey, String prefix) {
    this.listName = listName;
    this.resultKey = resultKey;
    this.prefix = prefix;
  }

  public String getListName() {
    return listName;
  }

  public String getResultKey() {
    return resultKey;
  }

  public String getPrefix() {
    return prefix;
  }

  public String endpoint() {
    return "/" + listName + ".list";
  }
}
