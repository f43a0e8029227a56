package com.flamingo.inboundmail.exception;

/** Exception thrown when a webhook signature is missing or does not verify. */
public class WebhookAuthenticationException extends RuntimeException {

  private final String providerId;

  public WebhookAuthenticationException(String providerId, String message) {
    super(message);
    this.providerId = providerId;
  }

  public String getProviderId() {
    return providerId;
  }
}
