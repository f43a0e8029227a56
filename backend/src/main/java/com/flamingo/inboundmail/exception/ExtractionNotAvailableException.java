package com.flamingo.inboundmail.exception;

import java.util.UUID;

/** Exception thrown when extracted text is requested for an attachment that has none yet. */
public class ExtractionNotAvailableException extends RuntimeException {

  private final UUID attachmentId;
  private final String userMessage;

  public ExtractionNotAvailableException(UUID attachmentId, String userMessage) {
    super("No extracted text for attachment " + attachmentId + ": " + userMessage);
    this.attachmentId = attachmentId;
    this.userMessage = userMessage;
  }

  public UUID getAttachmentId() {
    return attachmentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
