package com.flamingo.inboundmail.service.pipeline.batch;

import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.service.pipeline.ocr.OcrText;
import java.util.UUID;

/** What happened to one batch member's attempt. */
public record JobOutcome(
    UUID jobId, Status status, OcrText text, ErrorKind errorKind, String error) {

  /** Attempt status as seen by the batch. */
  public enum Status {
    SUCCEEDED,
    FAILED,
    /** Stopped because the batch was aborted before the attempt finished. */
    CANCELLED,
    /** The worker no longer held the claim when it tried to record the attempt. */
    LOST
  }

  public static JobOutcome succeeded(UUID jobId, OcrText text) {
    return new JobOutcome(jobId, Status.SUCCEEDED, text, null, null);
  }

  public static JobOutcome failed(UUID jobId, ErrorKind errorKind, String error) {
    return new JobOutcome(jobId, Status.FAILED, null, errorKind, error);
  }

  public static JobOutcome cancelled(UUID jobId) {
    return new JobOutcome(jobId, Status.CANCELLED, null, null, null);
  }

  public static JobOutcome lost(UUID jobId) {
    return new JobOutcome(jobId, Status.LOST, null, null, null);
  }

  public boolean isFailure() {
    return status == Status.FAILED;
  }
}
