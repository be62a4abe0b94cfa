package io.b2mash.chatops.slack.message;

public record TeamOption(long teamId, String slug) {

  ActionOption toActionOption() {
    return new ActionOption("#" + slug, "team:" + teamId);
  }
}
