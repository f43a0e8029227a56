package com.flamingo.inboundmail.service.pipeline.queue;

import com.flamingo.inboundmail.config.PipelineConfig;
import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.entity.ExtractionJob;
import com.flamingo.inboundmail.domain.entity.ExtractionResult;
import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.domain.enums.JobState;
import com.flamingo.inboundmail.domain.repository.ExtractionJobRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionResultRepository;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link JobQueue} backed by the {@code extraction_jobs} table.
 *
 * <p>A claim is a single conditional update from PENDING to IN_PROGRESS; the database serializes
 * competing updates of the same row, so exactly one worker sees an update count of 1. Workers
 * that lose simply move on to the next candidate.
 */
@Service
@Slf4j
public class DatabaseJobQueue implements JobQueue {

  private static final int CLAIM_CANDIDATES = 8;

  private final ExtractionJobRepository jobRepository;
  private final ExtractionResultRepository resultRepository;
  private final PipelineConfig pipelineConfig;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  private final ReentrantLock signalLock = new ReentrantLock();
  private final Condition workAvailable = signalLock.newCondition();
  private long signalGeneration;

  public DatabaseJobQueue(
      ExtractionJobRepository jobRepository,
      ExtractionResultRepository resultRepository,
      PipelineConfig pipelineConfig,
      PlatformTransactionManager transactionManager,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.jobRepository = jobRepository;
    this.resultRepository = resultRepository;
    this.pipelineConfig = pipelineConfig;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Transactional
  public ExtractionJob enqueue(Attachment attachment) {
    Optional<ExtractionJob> existing = jobRepository.findByAttachmentId(attachment.getId());
    if (existing.isPresent()) {
      log.debug("Attachment {} already has job {}", attachment.getId(), existing.get().getId());
      return existing.get();
    }

    ExtractionJob job =
        jobRepository.save(
            ExtractionJob.builder()
                .attachmentId(attachment.getId())
                .state(JobState.PENDING)
                .attemptCount(0)
                .enqueuedAt(LocalDateTime.now(clock))
                .build());
    meterRegistry.counter("extraction.jobs.enqueued").increment();
    log.info("Enqueued extraction job {} for attachment {}", job.getId(), attachment.getId());

    // Workers must not see the signal before the row is visible to them
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              signalWorkAvailable();
            }
          });
    } else {
      signalWorkAvailable();
    }
    return job;
  }

  @Override
  public Optional<ClaimedJob> tryClaim(String workerId) {
    int maxAttempts = pipelineConfig.getJobMaxAttempts();
    List<UUID> candidates =
        jobRepository.findClaimCandidateIds(maxAttempts, PageRequest.of(0, CLAIM_CANDIDATES));

    for (UUID jobId : candidates) {
      LocalDateTime now = LocalDateTime.now(clock);
      LocalDateTime leaseUntil = now.plus(pipelineConfig.claimLease());
      String claimToken = UUID.randomUUID().toString();
      Integer updated;
      try {
        updated =
            transactionTemplate.execute(
                status -> jobRepository.claim(
                        jobId, workerId, claimToken, now, leaseUntil, maxAttempts));
      } catch (ConcurrencyFailureException e) {
        log.debug("Claim of job {} by {} lost to a concurrent update", jobId, workerId);
        continue;
      }
      if (updated != null && updated == 1) {
        ExtractionJob job = jobRepository.findById(jobId).orElseThrow();
        meterRegistry.counter("extraction.jobs.claimed").increment();
        log.debug("Worker {} claimed job {} (attempt {})", workerId, jobId, job.getAttemptCount());
        return Optional.of(
            new ClaimedJob(
                jobId,
                job.getAttachmentId(),
                workerId,
                claimToken,
                job.getAttemptCount(),
                leaseUntil));
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<ClaimedJob> claimNext(String workerId, Duration maxWait)
      throws InterruptedException {
    long deadline = System.nanoTime() + maxWait.toNanos();
    long pollNanos =
        TimeUnit.MILLISECONDS.toNanos(pipelineConfig.getWorker().getPollIntervalMillis());

    while (true) {
      long seenGeneration = currentGeneration();
      Optional<ClaimedJob> claimed = tryClaim(workerId);
      if (claimed.isPresent()) {
        return claimed;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return Optional.empty();
      }
      signalLock.lockInterruptibly();
      try {
        if (signalGeneration == seenGeneration) {
          workAvailable.awaitNanos(Math.min(remaining, pollNanos));
        }
      } finally {
        signalLock.unlock();
      }
    }
  }

  @Override
  public void signalWorkAvailable() {
    signalLock.lock();
    try {
      signalGeneration++;
      workAvailable.signalAll();
    } finally {
      signalLock.unlock();
    }
  }

  @Override
  @Scheduled(
      fixedDelayString = "${pipeline.worker.lease-reaper-interval-millis:15000}",
      initialDelayString = "${pipeline.worker.lease-reaper-interval-millis:15000}")
  @Retry(name = "jobStore")
  public int reapExpiredLeases() {
    LocalDateTime now = LocalDateTime.now(clock);
    List<ExtractionJob> expired = jobRepository.findExpiredLeases(now);
    if (expired.isEmpty()) {
      return 0;
    }

    int reaped = 0;
    int requeued = 0;
    for (ExtractionJob job : expired) {
      boolean exhausted = job.attemptsExhausted(pipelineConfig.getJobMaxAttempts());
      Integer updated =
          transactionTemplate.execute(
              status -> {
                if (!exhausted) {
                  return jobRepository.releaseExpiredLease(job.getId(), job.getClaimToken(), now);
                }
                int count = jobRepository.expireLease(job.getId(), job.getClaimToken(), now);
                if (count == 1 && !resultRepository.existsByJobId(job.getId())) {
                  resultRepository.save(
                      ExtractionResult.failure(
                          job.getId(), job.getAttachmentId(), ErrorKind.TIMEOUT, now));
                }
                return count;
              });
      if (updated != null && updated == 1) {
        reaped++;
        if (!exhausted) {
          requeued++;
        }
        log.warn(
            "Lease of job {} held by {} expired, {}",
            job.getId(),
            job.getClaimedBy(),
            exhausted ? "attempts exhausted" : "returned to queue");
      }
    }

    meterRegistry.counter("extraction.jobs.lease_expired").increment(reaped);
    if (requeued > 0) {
      signalWorkAvailable();
    }
    return reaped;
  }

  private long currentGeneration() {
    signalLock.lock();
    try {
      return signalGeneration;
    } finally {
      signalLock.unlock();
    }
  }
}
