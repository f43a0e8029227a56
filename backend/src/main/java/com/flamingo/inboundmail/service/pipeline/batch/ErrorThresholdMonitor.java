package com.flamingo.inboundmail.service.pipeline.batch;

import com.flamingo.inboundmail.exception.BatchThresholdExceededException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Compares a batch's failed share against the configured maximum. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ErrorThresholdMonitor {

  private final MeterRegistry meterRegistry;

  /**
   * Checks a settled batch.
   *
   * @throws BatchThresholdExceededException if {@code failed / total * 100 > maxErrorPercentage}
   */
  public void check(UUID batchId, int failed, int total, double maxErrorPercentage) {
    double percentage = errorPercentage(failed, total);
    meterRegistry.summary("batch.error.percentage").record(percentage);
    if (percentage > maxErrorPercentage) {
      meterRegistry.counter("batch.threshold.exceeded").increment();
      throw new BatchThresholdExceededException(batchId, failed, total, maxErrorPercentage);
    }
  }

  /**
   * True once the failures alone exceed the maximum share of the batch's capacity. A batch never
   * holds more than its capacity, so the final ratio can only be higher.
   */
  public boolean isExceedanceCertain(int failed, int capacity, double maxErrorPercentage) {
    return capacity > 0 && errorPercentage(failed, capacity) > maxErrorPercentage;
  }

  public double errorPercentage(int failed, int total) {
    return total == 0 ? 0.0 : failed * 100.0 / total;
  }
}
