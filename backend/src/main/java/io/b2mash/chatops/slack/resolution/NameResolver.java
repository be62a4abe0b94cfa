package io.b2mash.chatops.slack.resolution;

import io.b2mash.chatops.config.SlackProperties;
import io.b2mash.chatops.exception.DuplicateDisplayNameException;
import io.b2mash.chatops.slack.client.SlackApiException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a channel or user name to its Slack id by paging through {@code conversations.list}
 * and then {@code users.list}.
 *
 * <p>Within a listing, the first case-insensitive match on the unique {@code name} field wins
 * immediately. Users can also be matched by exact display name, but only once the whole user
 * listing has been scanned, and two such matches make the name ambiguous. The deadline is checked
 * after every page, so a single slow page can overrun it.
 */
@Component
public class NameResolver {

  private static final Logger log = LoggerFactory.getLogger(NameResolver.class);

  private final RemoteListClient listClient;
  private final Clock clock;
  private final int pageSize;

  public NameResolver(RemoteListClient listClient, Clock clock, SlackProperties properties) {
    this.listClient = listClient;
    this.clock = clock;
    this.pageSize = properties.listPageSize();
  }

  /**
   * @throws DuplicateDisplayNameException if several users share the requested display name and
   *     none has it as username
   */
  public ResolutionResult resolve(ResolutionQuery query) {
    String name = query.name();
    String prefix = ListType.USERS.getPrefix();

    for (ListType listType : ListType.SEARCH_ORDER) {
      prefix = listType.getPrefix();
      String candidateId = null;
      boolean foundDuplicate = false;
      String cursor = "";

      while (true) {
        ListPage page;
        try {
          page = listClient.fetch(query.credentials(), listType, cursor, pageSize);
        } catch (SlackApiException e) {
          log.info(
              "Slack list call failed during channel lookup: listType={}, error={}",
              listType.getListName(),
              e.getMessage());
          return ResolutionResult.notFound(prefix);
        }

        for (ListItem item : page.items()) {
          if (item.name() != null && item.name().equalsIgnoreCase(name)) {
            return ResolutionResult.found(prefix, item.id());
          }
          if (listType == ListType.USERS && name.equals(item.displayName())) {
            if (candidateId != null) {
              foundDuplicate = true;
            } else {
              candidateId = item.id();
            }
          }
        }

        if (clock.instant().isAfter(query.deadline())) {
          log.debug(
              "Channel lookup ran out of time: listType={}, deadline={}",
              listType.getListName(),
              query.deadline());
          return ResolutionResult.timedOut(prefix);
        }

        if (!page.hasMore()) {
          break;
        }
        cursor = page.nextCursor();
      }

      if (foundDuplicate) {
        throw new DuplicateDisplayNameException(name);
      }
      if (candidateId != null) {
        return ResolutionResult.found(prefix, candidateId);
      }
    }

    return ResolutionResult.notFound(prefix);
  }
}
