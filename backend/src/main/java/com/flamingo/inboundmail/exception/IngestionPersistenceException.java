package com.flamingo.inboundmail.exception;

/**
 * Exception thrown when an admitted event or its attachments cannot be stored. Surfaces as a 5xx so
 * the provider retries the delivery.
 */
public class IngestionPersistenceException extends RuntimeException {

  private final String userMessage;

  public IngestionPersistenceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Failed to store webhook event";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
