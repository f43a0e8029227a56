package com.flamingo.inboundmail.exception;

/** Exception thrown when registering an organization under a name already in use. */
public class DuplicateOrganizationException extends RuntimeException {

  private final String name;

  public DuplicateOrganizationException(String name) {
    super("Organization already exists: " + name);
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
