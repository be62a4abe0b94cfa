package io.b2mash.chatops.integration;

import io.b2mash.chatops.exception.InvalidStateException;

/** How the Slack app was installed into a workspace. */
public enum InstallationType {
  /** Legacy bot installs; these carried a user access token alongside the bot token. */
  CLASSIC_BOT("classic_bot"),
  WORKSPACE_APP("workspace_app");

  private final String slug;

  InstallationType(String slug) {
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }

  /**
   * Infers the installation type from install metadata when the explicit type is absent. Classic
   * bots are recognized by the presence of a user access token.
   */
  public static InstallationType infer(String declaredType, boolean hasUserAccessToken) {
    if (declaredType != null) {
      for (var type : values()) {
        if (type.slug.equals(declaredType)) {
          return type;
        }
      }
      throw new InvalidStateException(
          "Unknown installation type", "Unsupported installation type: " + declaredType);
    }
    return hasUserAccessToken ? CLASSIC_BOT : WORKSPACE_APP;
  }
}
