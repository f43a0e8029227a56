package com.flamingo.inboundmail.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(WebhookAuthenticationException.class)
  public ResponseEntity<ApiError> handleWebhookAuthentication(
      WebhookAuthenticationException ex, HttpServletRequest request) {

    incrementErrorCounter("webhook_authentication");
    String errorId = generateErrorId();
    log.warn(
        "Webhook authentication failed [{}]: provider={}, {}",
        errorId,
        ex.getProviderId(),
        ex.getMessage());

    return build(
        HttpStatus.UNAUTHORIZED,
        errorId,
        ApiError.WEBHOOK_AUTHENTICATION_FAILED,
        "Webhook signature is missing or invalid",
        request);
  }

  @ExceptionHandler(MalformedPayloadException.class)
  public ResponseEntity<ApiError> handleMalformedPayload(
      MalformedPayloadException ex, HttpServletRequest request) {

    incrementErrorCounter("webhook_malformed");
    String errorId = generateErrorId();
    log.warn(
        "Malformed webhook payload [{}]: provider={}, {}",
        errorId,
        ex.getProviderId(),
        ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.WEBHOOK_MALFORMED_PAYLOAD,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ProviderNotFoundException.class)
  public ResponseEntity<ApiError> handleProviderNotFound(
      ProviderNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("provider_not_found");
    String errorId = generateErrorId();
    log.warn("Unknown webhook provider [{}]: {}", errorId, ex.getProviderId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.WEBHOOK_UNKNOWN_PROVIDER,
        "Unknown webhook provider",
        request);
  }

  @ExceptionHandler(IngestionPersistenceException.class)
  public ResponseEntity<ApiError> handleIngestionPersistence(
      IngestionPersistenceException ex, HttpServletRequest request) {

    incrementErrorCounter("persistence_error");
    String errorId = generateErrorId();
    log.error("Ingestion persistence error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.PERSISTENCE_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(OrganizationNotFoundException.class)
  public ResponseEntity<ApiError> handleOrganizationNotFound(
      OrganizationNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("organization_not_found");
    String errorId = generateErrorId();
    log.warn("Organization not found [{}]: {}", errorId, ex.getOrganizationId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.ORGANIZATION_NOT_FOUND,
        "Organization not found",
        request);
  }

  @ExceptionHandler(DuplicateOrganizationException.class)
  public ResponseEntity<ApiError> handleDuplicateOrganization(
      DuplicateOrganizationException ex, HttpServletRequest request) {

    incrementErrorCounter("organization_duplicate");
    String errorId = generateErrorId();
    log.warn("Duplicate organization [{}]: {}", errorId, ex.getName());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.ORGANIZATION_DUPLICATE,
        "An organization with this name already exists",
        request);
  }

  @ExceptionHandler(AttachmentNotFoundException.class)
  public ResponseEntity<ApiError> handleAttachmentNotFound(
      AttachmentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("attachment_not_found");
    String errorId = generateErrorId();
    log.warn("Attachment not found [{}]: {}", errorId, ex.getAttachmentId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.ATTACHMENT_NOT_FOUND,
        "Attachment not found",
        request);
  }

  @ExceptionHandler(ExtractionNotAvailableException.class)
  public ResponseEntity<ApiError> handleExtractionNotAvailable(
      ExtractionNotAvailableException ex, HttpServletRequest request) {

    incrementErrorCounter("extraction_not_available");
    String errorId = generateErrorId();
    log.debug("Extraction not available [{}]: {}", errorId, ex.getAttachmentId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.ATTACHMENT_NOT_EXTRACTED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
