package com.flamingo.inboundmail.service.pipeline.worker;

import com.flamingo.inboundmail.config.PipelineConfig;
import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.enums.CommitMode;
import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.domain.repository.AttachmentRepository;
import com.flamingo.inboundmail.exception.AttachmentStorageException;
import com.flamingo.inboundmail.exception.JobFailureException;
import com.flamingo.inboundmail.service.pipeline.batch.BatchCommitter;
import com.flamingo.inboundmail.service.pipeline.batch.BatchSettlementService;
import com.flamingo.inboundmail.service.pipeline.batch.BatchTicket;
import com.flamingo.inboundmail.service.pipeline.batch.JobOutcome;
import com.flamingo.inboundmail.service.pipeline.ocr.OcrEngine;
import com.flamingo.inboundmail.service.pipeline.ocr.OcrText;
import com.flamingo.inboundmail.service.pipeline.queue.ClaimedJob;
import com.flamingo.inboundmail.service.pipeline.queue.JobQueue;
import com.flamingo.inboundmail.service.storage.AttachmentStorage;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

/**
 * One worker loop: claim, enroll in the open batch, extract, record.
 *
 * <p>Failures of a single job never end the loop. The OCR call runs on a separate executor so the
 * worker can enforce the per-job timeout and react to its batch being aborted.
 */
@Slf4j
public class ExtractionWorker implements Runnable {

  private static final long ERROR_BACKOFF_MILLIS = 1000;

  private final String workerId;
  private final JobQueue jobQueue;
  private final BatchCommitter batchCommitter;
  private final BatchSettlementService settlementService;
  private final AttachmentRepository attachmentRepository;
  private final AttachmentStorage attachmentStorage;
  private final OcrEngine ocrEngine;
  private final AsyncTaskExecutor ocrExecutor;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  private volatile boolean running = true;

  ExtractionWorker(
      String workerId,
      JobQueue jobQueue,
      BatchCommitter batchCommitter,
      BatchSettlementService settlementService,
      AttachmentRepository attachmentRepository,
      AttachmentStorage attachmentStorage,
      OcrEngine ocrEngine,
      AsyncTaskExecutor ocrExecutor,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry) {
    this.workerId = workerId;
    this.jobQueue = jobQueue;
    this.batchCommitter = batchCommitter;
    this.settlementService = settlementService;
    this.attachmentRepository = attachmentRepository;
    this.attachmentStorage = attachmentStorage;
    this.ocrEngine = ocrEngine;
    this.ocrExecutor = ocrExecutor;
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
  }

  public String getWorkerId() {
    return workerId;
  }

  /** Asks the loop to exit after the current job. */
  public void stop() {
    running = false;
  }

  @Override
  public void run() {
    log.info("Worker {} started", workerId);
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        jobQueue
            .claimNext(workerId, pipelineConfig.getWorker().claimWait())
            .ifPresent(this::process);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (RuntimeException e) {
        log.error("Worker {} loop error: {}", workerId, e.getMessage(), e);
        meterRegistry.counter("extraction.worker.errors").increment();
        if (!backOff()) {
          break;
        }
      }
    }
    log.info("Worker {} stopped", workerId);
  }

  /** Runs one claimed job to an outcome and hands it to its batch. */
  void process(ClaimedJob job) {
    BatchTicket ticket = batchCommitter.enroll(job);
    JobOutcome outcome;
    try {
      outcome = execute(job, ticket);
    } catch (RuntimeException e) {
      // an enrolled member must always report, or its batch never closes
      log.error("Job {} failed unexpectedly: {}", job.jobId(), e.getMessage(), e);
      outcome =
          JobOutcome.failed(
              job.jobId(), ErrorKind.ENGINE_ERROR, "Unexpected error: " + e.getMessage());
    }

    if (ticket.batch().getCommitMode() == CommitMode.PER_ITEM) {
      outcome = persistItem(ticket, outcome);
    }
    meterRegistry
        .counter("extraction.attempts", "outcome", outcome.status().name().toLowerCase())
        .increment();
    batchCommitter.record(ticket, outcome);
  }

  private JobOutcome execute(ClaimedJob job, BatchTicket ticket) {
    if (ticket.isAborted()) {
      return JobOutcome.cancelled(job.jobId());
    }
    try {
      byte[] document = readDocument(job);
      OcrText text = extractWithTimeout(document, ticket);
      if (text == null) {
        log.debug("Job {} cancelled, batch {} aborted", job.jobId(), ticket.batchId());
        return JobOutcome.cancelled(job.jobId());
      }
      return JobOutcome.succeeded(job.jobId(), text);
    } catch (JobFailureException e) {
      log.warn(
          "Job {} attempt {} failed with {}: {}",
          job.jobId(),
          job.attemptCount(),
          e.getErrorKind(),
          e.getMessage());
      return JobOutcome.failed(job.jobId(), e.getErrorKind(), e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running = false;
      return JobOutcome.cancelled(job.jobId());
    }
  }

  private byte[] readDocument(ClaimedJob job) {
    Attachment attachment =
        attachmentRepository
            .findById(job.attachmentId())
            .orElseThrow(
                () ->
                    new JobFailureException(
                        ErrorKind.DECODE_ERROR, "Attachment " + job.attachmentId() + " missing"));
    try {
      return attachmentStorage.read(attachment.getStorageRef());
    } catch (AttachmentStorageException e) {
      throw new JobFailureException(ErrorKind.DECODE_ERROR, e.getMessage(), e);
    }
  }

  /** Returns null when the batch was aborted while waiting. */
  private OcrText extractWithTimeout(byte[] document, BatchTicket ticket)
      throws InterruptedException {
    Future<OcrText> future;
    try {
      future = ocrExecutor.submit(() -> ocrEngine.extract(document));
    } catch (TaskRejectedException e) {
      throw new JobFailureException(ErrorKind.ENGINE_ERROR, "OCR executor saturated", e);
    }

    long timeoutNanos = pipelineConfig.getWorker().ocrTimeout().toNanos();
    long sliceNanos =
        TimeUnit.MILLISECONDS.toNanos(pipelineConfig.getWorker().getAbortCheckIntervalMillis());
    long deadline = System.nanoTime() + timeoutNanos;

    try {
      while (true) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          future.cancel(true);
          throw new JobFailureException(
              ErrorKind.TIMEOUT,
              "OCR did not finish within " + pipelineConfig.getWorker().getOcrTimeoutSeconds()
                  + "s");
        }
        try {
          return future.get(Math.min(remaining, sliceNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
          if (ticket.isAborted()) {
            future.cancel(true);
            return null;
          }
        }
      }
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof JobFailureException failure) {
        throw failure;
      }
      throw new JobFailureException(
          ErrorKind.ENGINE_ERROR, "OCR engine error: " + cause.getMessage(), cause);
    } catch (CancellationException e) {
      throw new JobFailureException(ErrorKind.ENGINE_ERROR, "OCR call was cancelled", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  private JobOutcome persistItem(BatchTicket ticket, JobOutcome outcome) {
    try {
      return switch (outcome.status()) {
        case SUCCEEDED -> settlementService.commitItem(
                ticket.member(), ticket.batchId(), outcome.text())
            ? outcome
            : JobOutcome.lost(outcome.jobId());
        case FAILED -> settlementService.recordItemFailure(
                ticket.member(), ticket.batchId(), outcome.errorKind(), outcome.error())
            ? outcome
            : JobOutcome.lost(outcome.jobId());
        default -> outcome;
      };
    } catch (RuntimeException e) {
      // the claim stays IN_PROGRESS and the lease reaper returns it
      log.error("Could not persist job {}: {}", outcome.jobId(), e.getMessage(), e);
      return JobOutcome.lost(outcome.jobId());
    }
  }

  private boolean backOff() {
    try {
      Thread.sleep(ERROR_BACKOFF_MILLIS);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
