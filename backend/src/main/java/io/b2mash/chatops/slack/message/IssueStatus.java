package io.b2mash.chatops.slack.message;

public enum IssueStatus {
  UNRESOLVED,
  RESOLVED,
  IGNORED
}
