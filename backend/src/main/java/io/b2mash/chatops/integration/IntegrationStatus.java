package io.b2mash.chatops.integration;

public enum IntegrationStatus {
  ACTIVE,
  DISABLED
}
