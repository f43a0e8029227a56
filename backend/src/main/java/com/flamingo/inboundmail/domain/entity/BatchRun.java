package com.flamingo.inboundmail.domain.entity;

import com.flamingo.inboundmail.domain.enums.BatchOutcome;
import com.flamingo.inboundmail.domain.enums.CommitMode;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Record of one closed batch and the decision taken for it. */
@Entity
@Table(name = "batch_runs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchRun {

  /** Assigned when the batch opens, so members can reference it before the row exists. */
  @Id private UUID id;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "batch_run_jobs", joinColumns = @JoinColumn(name = "batch_run_id"))
  @Column(name = "job_id", nullable = false)
  @Builder.Default
  private List<UUID> jobIds = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private CommitMode commitMode;

  @Column(nullable = false)
  private double maxErrorPercentage;

  private int total;

  private int succeeded;

  private int failed;

  private int cancelled;

  /** True when the abort was decided before every member finished. */
  private boolean abortedEarly;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private BatchOutcome outcome;

  @Column(nullable = false)
  private LocalDateTime openedAt;

  @Column(nullable = false)
  private LocalDateTime closedAt;

  /** Failed share of the batch, in percent. */
  public double errorPercentage() {
    return total == 0 ? 0.0 : failed * 100.0 / total;
  }
}
