package com.flamingo.inboundmail.domain.entity;

import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.domain.enums.JobState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Unit of OCR work for one PDF attachment.
 *
 * <p>State changes after creation go through conditional updates in {@code
 * ExtractionJobRepository}, never through dirty checking of this entity, so that concurrent
 * workers cannot overwrite each other's transitions.
 */
@Entity
@Table(
    name = "extraction_jobs",
    uniqueConstraints =
        @UniqueConstraint(name = "uk_extraction_jobs_attachment", columnNames = "attachment_id"),
    indexes = @Index(name = "idx_extraction_jobs_state", columnList = "state, enqueued_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractionJob {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "attachment_id", nullable = false)
  private UUID attachmentId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  @Builder.Default
  private JobState state = JobState.PENDING;

  @Column(nullable = false)
  private int attemptCount;

  @Column(name = "enqueued_at", nullable = false, updatable = false)
  private LocalDateTime enqueuedAt;

  /** Worker holding the current claim. */
  private String claimedBy;

  /** Identifies the current claim; settlements carrying an older token no longer apply. */
  @Column(length = 36)
  private String claimToken;

  private LocalDateTime claimedAt;

  private LocalDateTime leaseExpiresAt;

  @Enumerated(EnumType.STRING)
  @Column(length = 16)
  private ErrorKind lastErrorKind;

  @Column(columnDefinition = "TEXT")
  private String lastError;

  /** Set while a failed attempt waits for its batch to decide between retry and terminal. */
  @Column(nullable = false)
  private boolean awaitingBatch;

  private UUID lastBatchRunId;

  private LocalDateTime completedAt;

  @PrePersist
  protected void onCreate() {
    if (enqueuedAt == null) {
      enqueuedAt = LocalDateTime.now();
    }
  }

  /** Returns true if no further attempt is allowed under the given bound. */
  public boolean attemptsExhausted(int maxAttempts) {
    return attemptCount >= maxAttempts;
  }
}
