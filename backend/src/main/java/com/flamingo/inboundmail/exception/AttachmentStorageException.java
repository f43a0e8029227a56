package com.flamingo.inboundmail.exception;

/** Exception thrown when attachment bytes cannot be written to or read from storage. */
public class AttachmentStorageException extends RuntimeException {

  private final String storageRef;

  public AttachmentStorageException(String storageRef, String message, Throwable cause) {
    super(message, cause);
    this.storageRef = storageRef;
  }

  public String getStorageRef() {
    return storageRef;
  }
}
