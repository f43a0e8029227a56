package com.flamingo.inboundmail.exception;

import java.util.UUID;

/** Exception thrown when an organization is not found. */
public class OrganizationNotFoundException extends RuntimeException {

  private final UUID organizationId;

  public OrganizationNotFoundException(UUID organizationId) {
    super("Organization not found: " + organizationId);
    this.organizationId = organizationId;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }
}
