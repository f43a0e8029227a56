package com.flamingo.inboundmail.service.pipeline.batch;

import com.flamingo.inboundmail.domain.enums.CommitMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;

/**
 * Collects the members of one batch and their outcomes until the batch can be settled.
 *
 * <p>A batch is open until it is sealed, either because it is full, its flush timeout passed, or
 * it was aborted. It is complete once it is sealed and every member has an outcome. All mutators
 * are synchronized on the instance.
 */
public class BatchAccumulator {

  @Getter private final UUID id;
  @Getter private final int capacity;
  @Getter private final CommitMode commitMode;
  @Getter private final double maxErrorPercentage;
  @Getter private final LocalDateTime openedAt;

  private final Map<UUID, BatchMember> members = new LinkedHashMap<>();
  private final Map<UUID, JobOutcome> outcomes = new HashMap<>();
  private boolean sealed;
  private boolean settling;
  private boolean abortedEarly;
  private volatile boolean aborted;

  public BatchAccumulator(
      int capacity, CommitMode commitMode, double maxErrorPercentage, LocalDateTime openedAt) {
    this.id = UUID.randomUUID();
    this.capacity = capacity;
    this.commitMode = commitMode;
    this.maxErrorPercentage = maxErrorPercentage;
    this.openedAt = openedAt;
  }

  /** Adds a member; seals the batch when it reaches capacity. Returns false if already sealed. */
  public synchronized boolean enroll(BatchMember member) {
    if (sealed) {
      return false;
    }
    members.put(member.jobId(), member);
    if (members.size() >= capacity) {
      sealed = true;
    }
    return true;
  }

  public synchronized void seal() {
    sealed = true;
  }

  public synchronized boolean isSealed() {
    return sealed;
  }

  public synchronized void record(JobOutcome outcome) {
    if (!members.containsKey(outcome.jobId())) {
      throw new IllegalArgumentException(
          "Job " + outcome.jobId() + " is not a member of batch " + id);
    }
    outcomes.putIfAbsent(outcome.jobId(), outcome);
  }

  /** Marks the batch aborted before all members finished; no further members are accepted. */
  public synchronized void abortEarly() {
    if (!aborted) {
      aborted = true;
      abortedEarly = true;
      sealed = true;
    }
  }

  public boolean isAborted() {
    return aborted;
  }

  public synchronized int failedCount() {
    return (int) outcomes.values().stream().filter(JobOutcome::isFailure).count();
  }

  public synchronized int size() {
    return members.size();
  }

  public synchronized boolean isComplete() {
    return sealed && outcomes.size() == members.size();
  }

  /**
   * Reserves the right to settle this batch. Returns true exactly once, to the first caller that
   * finds the batch complete.
   */
  public synchronized boolean claimSettlement() {
    if (settling || !isComplete()) {
      return false;
    }
    settling = true;
    return true;
  }

  /** Ids of members whose outcome is still held in memory or still being produced. */
  public synchronized List<UUID> memberIds() {
    return new ArrayList<>(members.keySet());
  }

  public synchronized BatchSnapshot snapshot() {
    List<BatchSnapshot.Entry> entries = new ArrayList<>(members.size());
    for (BatchMember member : members.values()) {
      entries.add(new BatchSnapshot.Entry(member, outcomes.get(member.jobId())));
    }
    return new BatchSnapshot(id, commitMode, maxErrorPercentage, openedAt, abortedEarly, entries);
  }
}
