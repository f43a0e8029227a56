package com.flamingo.inboundmail.domain.repository;

import com.flamingo.inboundmail.domain.entity.ExtractionJob;
import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.domain.enums.JobState;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for ExtractionJob entities.
 *
 * <p>Every transition is a conditional update guarded by the expected current state (and, for
 * claimed jobs, the claim token). A return value of 0 means another actor moved the job first.
 */
@Repository
public interface ExtractionJobRepository extends JpaRepository<ExtractionJob, UUID> {

  Optional<ExtractionJob> findByAttachmentId(UUID attachmentId);

  long countByState(JobState state);

  List<ExtractionJob> findByStateAndAwaitingBatchTrue(JobState state);

  /** Oldest claimable jobs first. */
  @Query(
      "SELECT j.id FROM ExtractionJob j "
          + "WHERE j.state = com.flamingo.inboundmail.domain.enums.JobState.PENDING "
          + "AND j.attemptCount < :maxAttempts ORDER BY j.enqueuedAt ASC")
  List<UUID> findClaimCandidateIds(@Param("maxAttempts") int maxAttempts, Pageable pageable);

  /** Claims a pending job: PENDING to IN_PROGRESS, one attempt consumed. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE ExtractionJob j SET j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS, "
          + "j.claimedBy = :workerId, j.claimToken = :claimToken, j.claimedAt = :now, "
          + "j.leaseExpiresAt = :leaseUntil, "
          + "j.attemptCount = j.attemptCount + 1 "
          + "WHERE j.id = :id AND j.state = com.flamingo.inboundmail.domain.enums.JobState.PENDING "
          + "AND j.attemptCount < :maxAttempts")
  int claim(
      @Param("id") UUID id,
      @Param("workerId") String workerId,
      @Param("claimToken") String claimToken,
      @Param("now") LocalDateTime now,
      @Param("leaseUntil") LocalDateTime leaseUntil,
      @Param("maxAttempts") int maxAttempts);

  /** Extends the lease of claimed jobs still waiting for their batch to close. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE ExtractionJob j SET j.leaseExpiresAt = :leaseUntil "
          + "WHERE j.id IN :ids AND j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS")
  int renewLeases(
      @Param("ids") Collection<UUID> ids, @Param("leaseUntil") LocalDateTime leaseUntil);

  /** Marks a claimed job as succeeded. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE ExtractionJob j SET j.state = com.flamingo.inboundmail.domain.enums.JobState.SUCCEEDED, "
          + "j.completedAt = :now, j.leaseExpiresAt = NULL, j.awaitingBatch = false, "
          + "j.lastBatchRunId = :batchRunId "
          + "WHERE j.id = :id AND j.claimToken = :claimToken "
          + "AND j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS")
  int markSucceeded(
      @Param("id") UUID id,
      @Param("claimToken") String claimToken,
      @Param("batchRunId") UUID batchRunId,
      @Param("now") LocalDateTime now);

  /** Records a failed attempt whose retry decision is left to the batch. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE ExtractionJob j SET j.state = com.flamingo.inboundmail.domain.enums.JobState.FAILED, "
          + "j.awaitingBatch = true, j.lastErrorKind = :errorKind, j.lastError = :error, "
          + "j.leaseExpiresAt = NULL, j.lastBatchRunId = :batchRunId "
          + "WHERE j.id = :id AND j.claimToken = :claimToken "
          + "AND j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS")
  int markAttemptFailed(
      @Param("id") UUID id,
      @Param("claimToken") String claimToken,
      @Param("batchRunId") UUID batchRunId,
      @Param("errorKind") ErrorKind errorKind,
      @Param("error") String error);

  /**
   * Returns a claimed or batch-held job to PENDING, giving back {@code refund} attempts. Applies to
   * jobs still IN_PROGRESS under this claim or FAILED and awaiting their batch. The error fields
   * are overwritten, pass nulls when the attempt did not fail.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE ExtractionJob j SET j.state = com.flamingo.inboundmail.domain.enums.JobState.PENDING, "
          + "j.claimedBy = NULL, j.claimToken = NULL, j.claimedAt = NULL, "
          + "j.leaseExpiresAt = NULL, "
          + "j.awaitingBatch = false, j.attemptCount = j.attemptCount - :refund, "
          + "j.lastErrorKind = :errorKind, j.lastError = :error, j.lastBatchRunId = :batchRunId "
          + "WHERE j.id = :id AND j.claimToken = :claimToken "
          + "AND (j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS "
          + "OR (j.state = com.flamingo.inboundmail.domain.enums.JobState.FAILED "
          + "AND j.awaitingBatch = true))")
  int requeue(
      @Param("id") UUID id,
      @Param("claimToken") String claimToken,
      @Param("batchRunId") UUID batchRunId,
      @Param("refund") int refund,
      @Param("errorKind") ErrorKind errorKind,
      @Param("error") String error);

  /** Fails a claimed or batch-held job for good. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE ExtractionJob j SET j.state = com.flamingo.inboundmail.domain.enums.JobState.FAILED, "
          + "j.awaitingBatch = false, j.lastErrorKind = :errorKind, "
          + "j.lastError = :error, j.leaseExpiresAt = NULL, "
          + "j.completedAt = :now, j.lastBatchRunId = :batchRunId "
          + "WHERE j.id = :id AND j.claimToken = :claimToken "
          + "AND (j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS "
          + "OR (j.state = com.flamingo.inboundmail.domain.enums.JobState.FAILED "
          + "AND j.awaitingBatch = true))")
  int markTerminallyFailed(
      @Param("id") UUID id,
      @Param("claimToken") String claimToken,
      @Param("batchRunId") UUID batchRunId,
      @Param("errorKind") ErrorKind errorKind,
      @Param("error") String error,
      @Param("now") LocalDateTime now);

  @Query(
      "SELECT j FROM ExtractionJob j "
          + "WHERE j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS "
          + "AND j.leaseExpiresAt < :now")
  List<ExtractionJob> findExpiredLeases(@Param("now") LocalDateTime now);

  /** Returns a job whose lease ran out to PENDING. The consumed attempt is kept. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE ExtractionJob j SET j.state = com.flamingo.inboundmail.domain.enums.JobState.PENDING, "
          + "j.claimedBy = NULL, j.claimToken = NULL, j.claimedAt = NULL, "
          + "j.leaseExpiresAt = NULL, "
          + "j.lastErrorKind = com.flamingo.inboundmail.domain.enums.ErrorKind.TIMEOUT, "
          + "j.lastError = 'Claim lease expired' "
          + "WHERE j.id = :id AND j.claimToken = :claimToken "
          + "AND j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS "
          + "AND j.leaseExpiresAt < :now")
  int releaseExpiredLease(
      @Param("id") UUID id,
      @Param("claimToken") String claimToken,
      @Param("now") LocalDateTime now);

  /** Fails a job whose lease ran out on its last allowed attempt. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE ExtractionJob j SET j.state = com.flamingo.inboundmail.domain.enums.JobState.FAILED, "
          + "j.leaseExpiresAt = NULL, j.completedAt = :now, j.awaitingBatch = false, "
          + "j.lastErrorKind = com.flamingo.inboundmail.domain.enums.ErrorKind.TIMEOUT, "
          + "j.lastError = 'Claim lease expired' "
          + "WHERE j.id = :id AND j.claimToken = :claimToken "
          + "AND j.state = com.flamingo.inboundmail.domain.enums.JobState.IN_PROGRESS "
          + "AND j.leaseExpiresAt < :now")
  int expireLease(
      @Param("id") UUID id,
      @Param("claimToken") String claimToken,
      @Param("now") LocalDateTime now);
}
