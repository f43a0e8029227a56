package com.flamingo.inboundmail.service.pipeline.batch;

import com.flamingo.inboundmail.config.PipelineConfig;
import com.flamingo.inboundmail.domain.entity.BatchRun;
import com.flamingo.inboundmail.domain.entity.ExtractionJob;
import com.flamingo.inboundmail.domain.entity.ExtractionResult;
import com.flamingo.inboundmail.domain.enums.BatchOutcome;
import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.domain.enums.JobState;
import com.flamingo.inboundmail.domain.repository.BatchRunRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionJobRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionResultRepository;
import com.flamingo.inboundmail.service.pipeline.ocr.OcrText;
import io.github.resilience4j.retry.annotation.Retry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists batch decisions. Each public method is one transaction; the single-transaction commit
 * path writes every result of the batch or none of them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchSettlementService {

  private final ExtractionJobRepository jobRepository;
  private final ExtractionResultRepository resultRepository;
  private final BatchRunRepository batchRunRepository;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  /**
   * Per-item mode: commits one successful result immediately.
   *
   * @return false if the worker no longer held the claim, in which case nothing is written
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  @Retry(name = "jobStore")
  public boolean commitItem(BatchMember member, UUID batchId, OcrText text) {
    LocalDateTime now = LocalDateTime.now(clock);
    if (jobRepository.markSucceeded(member.jobId(), member.claimToken(), batchId, now) != 1) {
      log.warn("Job {} no longer claimed by {}, result dropped", member.jobId(), member.workerId());
      return false;
    }
    resultRepository.save(
        ExtractionResult.success(
            member.jobId(), member.attachmentId(), text.text(), text.pageCount(), now));
    return true;
  }

  /**
   * Per-item mode: records a failed attempt; the retry decision waits for the batch.
   *
   * @return false if the worker no longer held the claim
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  @Retry(name = "jobStore")
  public boolean recordItemFailure(
      BatchMember member, UUID batchId, ErrorKind errorKind, String error) {
    return jobRepository.markAttemptFailed(
            member.jobId(), member.claimToken(), batchId, errorKind, error)
        == 1;
  }

  /** Single-transaction mode, threshold respected: writes every result and transition at once. */
  @Transactional
  public BatchRun commitBatch(BatchSnapshot snapshot) {
    LocalDateTime now = LocalDateTime.now(clock);
    Counts counts = new Counts();

    for (BatchSnapshot.Entry entry : snapshot.entries()) {
      BatchMember member = entry.member();
      JobOutcome outcome = entry.outcome();
      switch (outcome.status()) {
        case SUCCEEDED -> {
          int updated =
              jobRepository.markSucceeded(
                  member.jobId(), member.claimToken(), snapshot.batchId(), now);
          if (updated == 1) {
            resultRepository.save(
                ExtractionResult.success(
                    member.jobId(),
                    member.attachmentId(),
                    outcome.text().text(),
                    outcome.text().pageCount(),
                    now));
            counts.succeeded++;
          } else {
            counts.lost++;
          }
        }
        case FAILED -> {
          settleFailure(member, snapshot.batchId(), outcome, true, now);
          counts.failed++;
        }
        case CANCELLED -> {
          requeue(member, snapshot.batchId(), 1, null, null);
          counts.cancelled++;
        }
        case LOST -> counts.lost++;
      }
    }
    return saveRun(snapshot, BatchOutcome.COMMITTED, counts, now);
  }

  /**
   * Single-transaction mode, threshold breached or commit failed: no result rows; every member
   * goes back to PENDING. Successful and cancelled attempts are refunded. A failed attempt that
   * used the last allowed try is failed for good instead, since it could never be claimed again.
   */
  @Transactional
  @Retry(name = "jobStore")
  public BatchRun abortBatch(BatchSnapshot snapshot) {
    LocalDateTime now = LocalDateTime.now(clock);
    Counts counts = new Counts();

    for (BatchSnapshot.Entry entry : snapshot.entries()) {
      BatchMember member = entry.member();
      JobOutcome outcome = entry.outcome();
      switch (outcome.status()) {
        case SUCCEEDED -> {
          if (requeue(member, snapshot.batchId(), 1, null, null)) {
            counts.succeeded++;
          } else {
            counts.lost++;
          }
        }
        case FAILED -> {
          settleFailure(member, snapshot.batchId(), outcome, false, now);
          counts.failed++;
        }
        case CANCELLED -> {
          requeue(member, snapshot.batchId(), 1, null, null);
          counts.cancelled++;
        }
        case LOST -> counts.lost++;
      }
    }
    return saveRun(snapshot, BatchOutcome.ABORTED, counts, now);
  }

  /** Per-item mode: successes are already committed; decides retry or terminal for failures. */
  @Transactional
  @Retry(name = "jobStore")
  public BatchRun closePerItemBatch(BatchSnapshot snapshot, boolean thresholdExceeded) {
    LocalDateTime now = LocalDateTime.now(clock);
    Counts counts = new Counts();

    for (BatchSnapshot.Entry entry : snapshot.entries()) {
      JobOutcome outcome = entry.outcome();
      switch (outcome.status()) {
        case SUCCEEDED -> counts.succeeded++;
        case FAILED -> {
          settleFailure(entry.member(), snapshot.batchId(), outcome, true, now);
          counts.failed++;
        }
        case CANCELLED -> {
          requeue(entry.member(), snapshot.batchId(), 1, null, null);
          counts.cancelled++;
        }
        case LOST -> counts.lost++;
      }
    }
    BatchOutcome batchOutcome =
        thresholdExceeded ? BatchOutcome.PARTIALLY_COMMITTED : BatchOutcome.COMMITTED;
    return saveRun(snapshot, batchOutcome, counts, now);
  }

  /**
   * Settles failed attempts whose batch never closed, e.g. because the process stopped. Each is
   * retried if attempts remain, otherwise failed for good.
   *
   * @return number of jobs settled
   */
  @Transactional
  public int recoverOrphanedFailures() {
    return recoverOrphanedFailures(Set::of);
  }

  /**
   * Like {@link #recoverOrphanedFailures()}, but leaves alone failures whose batch is still open.
   * The open batches are read after the candidates, so a batch that closes in between has already
   * settled its members or never will.
   */
  @Transactional
  public int recoverOrphanedFailures(Supplier<Set<UUID>> openBatchIds) {
    List<ExtractionJob> candidates =
        jobRepository.findByStateAndAwaitingBatchTrue(JobState.FAILED);
    if (candidates.isEmpty()) {
      return 0;
    }
    Set<UUID> open = openBatchIds.get();
    LocalDateTime now = LocalDateTime.now(clock);
    int settled = 0;
    for (ExtractionJob job : candidates) {
      if (job.getLastBatchRunId() != null && open.contains(job.getLastBatchRunId())) {
        continue;
      }
      BatchMember member =
          new BatchMember(
              job.getId(),
              job.getAttachmentId(),
              job.getClaimedBy(),
              job.getClaimToken(),
              job.getAttemptCount());
      ErrorKind errorKind =
          job.getLastErrorKind() != null ? job.getLastErrorKind() : ErrorKind.ENGINE_ERROR;
      JobOutcome outcome = JobOutcome.failed(job.getId(), errorKind, job.getLastError());
      settleFailure(member, job.getLastBatchRunId(), outcome, true, now);
      settled++;
    }
    return settled;
  }

  /** Keeps claims of batch members alive while the batch is still open. */
  @Transactional
  public int renewLeases(Collection<UUID> jobIds) {
    if (jobIds.isEmpty()) {
      return 0;
    }
    return jobRepository.renewLeases(
        jobIds, LocalDateTime.now(clock).plus(pipelineConfig.claimLease()));
  }

  private void settleFailure(
      BatchMember member,
      UUID batchId,
      JobOutcome outcome,
      boolean writeResult,
      LocalDateTime now) {
    if (member.attemptCount() < pipelineConfig.getJobMaxAttempts()) {
      requeue(member, batchId, 0, outcome.errorKind(), outcome.error());
      return;
    }
    int updated =
        jobRepository.markTerminallyFailed(
            member.jobId(),
            member.claimToken(),
            batchId,
            outcome.errorKind(),
            outcome.error(),
            now);
    if (updated == 1 && writeResult && !resultRepository.existsByJobId(member.jobId())) {
      resultRepository.save(
          ExtractionResult.failure(member.jobId(), member.attachmentId(), outcome.errorKind(), now));
    }
    log.warn(
        "Job {} failed after {} attempts: {} {}",
        member.jobId(),
        member.attemptCount(),
        outcome.errorKind(),
        outcome.error());
  }

  private boolean requeue(
      BatchMember member, UUID batchId, int refund, ErrorKind errorKind, String error) {
    return jobRepository.requeue(
            member.jobId(), member.claimToken(), batchId, refund, errorKind, error)
        == 1;
  }

  private BatchRun saveRun(
      BatchSnapshot snapshot, BatchOutcome outcome, Counts counts, LocalDateTime now) {
    BatchRun run =
        BatchRun.builder()
            .id(snapshot.batchId())
            .jobIds(new ArrayList<>(snapshot.jobIds()))
            .commitMode(snapshot.commitMode())
            .maxErrorPercentage(snapshot.maxErrorPercentage())
            .total(counts.succeeded + counts.failed + counts.cancelled)
            .succeeded(counts.succeeded)
            .failed(counts.failed)
            .cancelled(counts.cancelled)
            .abortedEarly(snapshot.abortedEarly())
            .outcome(outcome)
            .openedAt(snapshot.openedAt())
            .closedAt(now)
            .build();
    if (counts.lost > 0) {
      log.warn("Batch {} lost {} members to expired claims", snapshot.batchId(), counts.lost);
    }
    return batchRunRepository.save(run);
  }

  private static final class Counts {
    private int succeeded;
    private int failed;
    private int cancelled;
    private int lost;
  }
}
