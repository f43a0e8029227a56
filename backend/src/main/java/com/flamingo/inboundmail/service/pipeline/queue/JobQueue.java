package com.flamingo.inboundmail.service.pipeline.queue;

import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.entity.ExtractionJob;
import java.time.Duration;
import java.util.Optional;

/** Durable queue of extraction jobs. */
public interface JobQueue {

  /**
   * Creates the PENDING job for an attachment, or returns the existing one. Joins the caller's
   * transaction; waiting workers are signalled once it commits.
   */
  ExtractionJob enqueue(Attachment attachment);

  /** Claims the oldest claimable job without waiting. */
  Optional<ClaimedJob> tryClaim(String workerId);

  /**
   * Claims a job, blocking up to {@code maxWait} for one to become available.
   *
   * @throws InterruptedException if the calling worker is interrupted while waiting
   */
  Optional<ClaimedJob> claimNext(String workerId, Duration maxWait) throws InterruptedException;

  /** Wakes workers blocked in {@link #claimNext}. */
  void signalWorkAvailable();

  /**
   * Returns jobs whose claim lease expired to PENDING, or fails them with a timeout once attempts
   * are exhausted.
   *
   * @return number of jobs reaped
   */
  int reapExpiredLeases();
}
