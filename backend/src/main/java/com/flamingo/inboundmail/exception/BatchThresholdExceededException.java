package com.flamingo.inboundmail.exception;

import java.util.UUID;

/** Raised when the failed share of a batch is above the configured maximum. */
public class BatchThresholdExceededException extends RuntimeException {

  private final UUID batchId;
  private final int failed;
  private final int total;
  private final double maxErrorPercentage;

  public BatchThresholdExceededException(
      UUID batchId, int failed, int total, double maxErrorPercentage) {
    super(
        String.format(
            "Batch %s failed %d of %d jobs, above the %.1f%% limit",
            batchId, failed, total, maxErrorPercentage));
    this.batchId = batchId;
    this.failed = failed;
    this.total = total;
    this.maxErrorPercentage = maxErrorPercentage;
  }

  public UUID getBatchId() {
    return batchId;
  }

  public int getFailed() {
    return failed;
  }

  public int getTotal() {
    return total;
  }

  public double getMaxErrorPercentage() {
    return maxErrorPercentage;
  }
}
