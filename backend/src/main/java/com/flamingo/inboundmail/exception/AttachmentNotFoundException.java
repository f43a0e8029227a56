package com.flamingo.inboundmail.exception;

import java.util.UUID;

/** Exception thrown when an attachment is not found. */
public class AttachmentNotFoundException extends RuntimeException {

  private final UUID attachmentId;

  public AttachmentNotFoundException(UUID attachmentId) {
    super("Attachment not found: " + attachmentId);
    this.attachmentId = attachmentId;
  }

  public UUID getAttachmentId() {
    return attachmentId;
  }
}
