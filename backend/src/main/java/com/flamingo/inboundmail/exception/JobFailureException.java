package com.flamingo.inboundmail.exception;

import com.flamingo.inboundmail.domain.enums.ErrorKind;

/**
 * Exception describing why a single extraction attempt failed. Never fatal to the worker that
 * raised it; the job is retried or failed according to the batch policy.
 */
public class JobFailureException extends RuntimeException {

  private final ErrorKind errorKind;

  public JobFailureException(ErrorKind errorKind, String message) {
    super(message);
    this.errorKind = errorKind;
  }

  public JobFailureException(ErrorKind errorKind, String message, Throwable cause) {
    super(message, cause);
    this.errorKind = errorKind;
  }

  public ErrorKind getErrorKind() {
    return errorKind;
  }
}
