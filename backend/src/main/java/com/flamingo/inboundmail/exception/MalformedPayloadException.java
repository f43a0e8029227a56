package com.flamingo.inboundmail.exception;

/** Exception thrown when a verified webhook body is not structurally valid. */
public class MalformedPayloadException extends RuntimeException {

  private final String providerId;
  private final String userMessage;

  public MalformedPayloadException(String providerId, String message) {
    super(message);
    this.providerId = providerId;
    this.userMessage = message;
  }

  public MalformedPayloadException(String providerId, String message, Throwable cause) {
    super(message, cause);
    this.providerId = providerId;
    this.userMessage = message;
  }

  public String getProviderId() {
    return providerId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
