package com.flamingo.inboundmail.service.pipeline.batch;

import com.flamingo.inboundmail.domain.enums.CommitMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/** Frozen view of a completed batch, handed to settlement. */
public record BatchSnapshot(
    UUID batchId,
    CommitMode commitMode,
    double maxErrorPercentage,
    LocalDateTime openedAt,
    boolean abortedEarly,
    List<Entry> entries) {

  public BatchSnapshot {
    entries = List.copyOf(entries);
  }

  /** A member together with its recorded outcome. */
  public record Entry(BatchMember member, JobOutcome outcome) {}

  /** Members that count towards the error ratio. */
  public int total() {
    return (int)
        entries.stream().filter(e -> e.outcome().status() != JobOutcome.Status.LOST).count();
  }

  public int failed() {
    return (int) entries.stream().filter(e -> e.outcome().isFailure()).count();
  }

  public List<UUID> jobIds() {
    return entries.stream().map(e -> e.member().jobId()).toList();
  }
}
