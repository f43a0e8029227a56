package com.flamingo.inboundmail.exception;

/** Exception thrown when a webhook arrives for a provider with no registered adapter. */
public class ProviderNotFoundException extends RuntimeException {

  private final String providerId;

  public ProviderNotFoundException(String providerId) {
    super("Unknown webhook provider: " + providerId);
    this.providerId = providerId;
  }

  public String getProviderId() {
    return providerId;
  }
}
