package com.flamingo.inboundmail.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String WEBHOOK_AUTHENTICATION_FAILED = "WEBHOOK_001";
  public static final String WEBHOOK_MALFORMED_PAYLOAD = "WEBHOOK_002";
  public static final String WEBHOOK_UNKNOWN_PROVIDER = "WEBHOOK_003";
  public static final String PERSISTENCE_FAILED = "PERSISTENCE_001";
  public static final String ORGANIZATION_NOT_FOUND = "ORGANIZATION_001";
  public static final String ORGANIZATION_DUPLICATE = "ORGANIZATION_002";
  public static final String ATTACHMENT_NOT_FOUND = "ATTACHMENT_001";
  public static final String ATTACHMENT_NOT_EXTRACTED = "ATTACHMENT_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
