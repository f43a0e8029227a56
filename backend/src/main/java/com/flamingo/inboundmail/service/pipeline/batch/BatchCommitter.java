package com.flamingo.inboundmail.service.pipeline.batch;

import com.flamingo.inboundmail.config.PipelineConfig;
import com.flamingo.inboundmail.domain.entity.BatchRun;
import com.flamingo.inboundmail.domain.enums.CommitMode;
import com.flamingo.inboundmail.exception.BatchThresholdExceededException;
import com.flamingo.inboundmail.service.pipeline.queue.ClaimedJob;
import com.flamingo.inboundmail.service.pipeline.queue.JobQueue;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Groups claimed jobs into batches and settles each batch once all its members have an outcome.
 *
 * <p>Workers enroll a job when they start it and record its outcome when done. The open batch is
 * sealed when it reaches {@code pipeline.batch-commit-size} members or when {@code
 * pipeline.batch-flush-timeout-seconds} have passed since it opened. Settlement runs on whichever
 * thread completes the batch: the worker recording the last outcome, or the flush task.
 */
@Service
@Slf4j
public class BatchCommitter {

  private final PipelineConfig pipelineConfig;
  private final ErrorThresholdMonitor thresholdMonitor;
  private final BatchSettlementService settlementService;
  private final JobQueue jobQueue;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  private final Object openBatchLock = new Object();
  private BatchAccumulator openBatch;
  private final Set<BatchAccumulator> activeBatches = ConcurrentHashMap.newKeySet();

  public BatchCommitter(
      PipelineConfig pipelineConfig,
      ErrorThresholdMonitor thresholdMonitor,
      BatchSettlementService settlementService,
      JobQueue jobQueue,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.pipelineConfig = pipelineConfig;
    this.thresholdMonitor = thresholdMonitor;
    this.settlementService = settlementService;
    this.jobQueue = jobQueue;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /** Adds the job to the open batch, opening a new one if needed. */
  public BatchTicket enroll(ClaimedJob job) {
    BatchMember member = BatchMember.of(job);
    synchronized (openBatchLock) {
      if (openBatch == null || !openBatch.enroll(member)) {
        openBatch =
            new BatchAccumulator(
                pipelineConfig.getBatchCommitSize(),
                pipelineConfig.commitMode(),
                pipelineConfig.getMaxErrorPercentage(),
                LocalDateTime.now(clock));
        activeBatches.add(openBatch);
        openBatch.enroll(member);
        log.debug("Opened batch {} ({})", openBatch.getId(), openBatch.getCommitMode());
      }
      return new BatchTicket(openBatch, member);
    }
  }

  /**
   * Records a member's outcome. Settles the batch if this was the last outcome it was waiting for.
   *
   * @return the closed run if this call settled the batch
   */
  public Optional<BatchRun> record(BatchTicket ticket, JobOutcome outcome) {
    BatchAccumulator batch = ticket.batch();
    batch.record(outcome);

    if (batch.getCommitMode() == CommitMode.SINGLE_TRANSACTION
        && outcome.isFailure()
        && !batch.isAborted()
        && thresholdMonitor.isExceedanceCertain(
            batch.failedCount(), batch.getCapacity(), batch.getMaxErrorPercentage())) {
      batch.abortEarly();
      meterRegistry.counter("batch.aborted.early").increment();
      log.warn(
          "Batch {} aborted early after {} failures, in-flight members will be cancelled",
          batch.getId(),
          batch.failedCount());
    }
    return settleIfComplete(batch);
  }

  /** Seals the open batch once its flush timeout passes and settles completed batches. */
  @Scheduled(
      fixedDelayString = "${pipeline.worker.batch-flush-check-interval-millis:1000}",
      initialDelayString = "${pipeline.worker.batch-flush-check-interval-millis:1000}")
  public List<BatchRun> flushExpiredBatches() {
    synchronized (openBatchLock) {
      if (openBatch != null && !openBatch.isSealed() && flushTimeoutPassed(openBatch)) {
        openBatch.seal();
        log.debug("Batch {} sealed by flush timeout with {} jobs", openBatch.getId(),
            openBatch.size());
      }
      if (openBatch != null && openBatch.isSealed()) {
        openBatch = null;
      }
    }

    List<BatchRun> closed = new ArrayList<>();
    for (BatchAccumulator batch : new ArrayList<>(activeBatches)) {
      Optional<BatchRun> run = settleIfComplete(batch);
      if (run.isPresent()) {
        closed.add(run.get());
      } else if (batch.getCommitMode() == CommitMode.SINGLE_TRANSACTION) {
        renewLeases(batch);
      }
    }
    return closed;
  }

  /**
   * Settles failed attempts left waiting by a batch whose settlement failed. Failures of batches
   * that are still open are left to their batch.
   *
   * @return number of jobs settled
   */
  @Scheduled(
      fixedDelayString = "${pipeline.worker.lease-reaper-interval-millis:15000}",
      initialDelayString = "${pipeline.worker.lease-reaper-interval-millis:15000}")
  public int recoverStalledFailures() {
    int settled;
    try {
      settled = settlementService.recoverOrphanedFailures(this::openBatchIds);
    } catch (DataAccessException e) {
      log.warn("Could not recover stalled failures: {}", e.getMessage());
      return 0;
    }
    if (settled > 0) {
      log.warn("Settled {} failed jobs whose batch never closed", settled);
      meterRegistry.counter("batch.failures.recovered").increment(settled);
      jobQueue.signalWorkAvailable();
    }
    return settled;
  }

  /** Number of batches opened but not yet settled. */
  public int activeBatchCount() {
    return activeBatches.size();
  }

  private Set<UUID> openBatchIds() {
    return activeBatches.stream().map(BatchAccumulator::getId).collect(Collectors.toSet());
  }

  private boolean flushTimeoutPassed(BatchAccumulator batch) {
    Duration age = Duration.between(batch.getOpenedAt(), LocalDateTime.now(clock));
    return age.compareTo(pipelineConfig.batchFlushTimeout()) >= 0;
  }

  private Optional<BatchRun> settleIfComplete(BatchAccumulator batch) {
    if (!batch.claimSettlement()) {
      return Optional.empty();
    }
    try {
      BatchRun run = settle(batch.snapshot());
      meterRegistry.counter("batch.runs", "outcome", run.getOutcome().name()).increment();
      log.info(
          "Batch {} closed {}: {} succeeded, {} failed of {} ({})",
          run.getId(),
          run.getOutcome(),
          run.getSucceeded(),
          run.getFailed(),
          run.getTotal(),
          run.getCommitMode());
      return Optional.of(run);
    } catch (DataAccessException e) {
      // Claimed members go back through the lease reaper, failed ones through
      // recoverStalledFailures.
      log.error("Failed to settle batch {}: {}", batch.getId(), e.getMessage(), e);
      meterRegistry.counter("batch.settlement.failed").increment();
      return Optional.empty();
    } finally {
      activeBatches.remove(batch);
      synchronized (openBatchLock) {
        if (openBatch == batch) {
          openBatch = null;
        }
      }
      jobQueue.signalWorkAvailable();
    }
  }

  private BatchRun settle(BatchSnapshot snapshot) {
    boolean exceeded = false;
    try {
      thresholdMonitor.check(
          snapshot.batchId(), snapshot.failed(), snapshot.total(), snapshot.maxErrorPercentage());
    } catch (BatchThresholdExceededException e) {
      log.warn(e.getMessage());
      exceeded = true;
    }

    if (snapshot.commitMode() == CommitMode.PER_ITEM) {
      return settlementService.closePerItemBatch(snapshot, exceeded);
    }
    if (exceeded || snapshot.abortedEarly()) {
      return settlementService.abortBatch(snapshot);
    }
    try {
      return settlementService.commitBatch(snapshot);
    } catch (DataAccessException e) {
      log.error(
          "Commit of batch {} rolled back, aborting: {}", snapshot.batchId(), e.getMessage(), e);
      return settlementService.abortBatch(snapshot);
    }
  }

  private void renewLeases(BatchAccumulator batch) {
    try {
      settlementService.renewLeases(batch.memberIds());
    } catch (DataAccessException e) {
      log.warn("Could not renew leases of batch {}: {}", batch.getId(), e.getMessage());
    }
  }
}
