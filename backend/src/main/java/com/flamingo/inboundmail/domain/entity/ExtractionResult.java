package com.flamingo.inboundmail.domain.entity;

import com.flamingo.inboundmail.domain.enums.ErrorKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Final output of an extraction job. Exactly one per job, written once. */
@Entity
@Table(
    name = "extraction_results",
    uniqueConstraints =
        @UniqueConstraint(name = "uk_extraction_results_job", columnNames = "job_id"))
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractionResult {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "job_id", nullable = false, updatable = false)
  private UUID jobId;

  @Column(nullable = false, updatable = false)
  private UUID attachmentId;

  /** Extracted text, null when the job failed terminally. */
  @Column(columnDefinition = "TEXT", updatable = false)
  private String text;

  private Integer pageCount;

  private Integer characterCount;

  @Enumerated(EnumType.STRING)
  @Column(length = 16, updatable = false)
  private ErrorKind errorKind;

  @Column(nullable = false, updatable = false)
  private LocalDateTime completedAt;

  /** Builds a successful result. */
  public static ExtractionResult success(
      UUID jobId, UUID attachmentId, String text, int pageCount, LocalDateTime completedAt) {
    return ExtractionResult.builder()
        .jobId(jobId)
        .attachmentId(attachmentId)
        .text(text)
        .pageCount(pageCount)
        .characterCount(text == null ? 0 : text.length())
        .completedAt(completedAt)
        .build();
  }

  /** Builds a terminal failure result. */
  public static ExtractionResult failure(
      UUID jobId, UUID attachmentId, ErrorKind errorKind, LocalDateTime completedAt) {
    return ExtractionResult.builder()
        .jobId(jobId)
        .attachmentId(attachmentId)
        .errorKind(errorKind)
        .completedAt(completedAt)
        .build();
  }

  public boolean isSuccessful() {
    return errorKind == null;
  }
}
