package io.b2mash.chatops.slack.message;

/**
 * A project member that can be assigned.
 *
 * @param slackUserId the member's linked Slack user id in this workspace, or null if not linked
 */
public record MemberOption(long userId, String displayName, String slackUserId) {

  ActionOption toActionOption() {
    return new ActionOption(displayName, "user:" + userId);
  }
}
