package com.flamingo.inboundmail.service.pipeline.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.inboundmail.exception.BatchThresholdExceededException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ErrorThresholdMonitorTest {

  private SimpleMeterRegistry meterRegistry;
  private ErrorThresholdMonitor monitor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    monitor = new ErrorThresholdMonitor(meterRegistry);
  }

  @Test
  @DisplayName("Should pass when the failed share equals the maximum")
  void shouldPassAtExactlyTheMaximum() {
    assertThatCode(() -> monitor.check(UUID.randomUUID(), 2, 10, 20.0))
        .doesNotThrowAnyException();
    assertThat(meterRegistry.counter("batch.threshold.exceeded").count()).isZero();
  }

  @Test
  @DisplayName("Should raise when the failed share exceeds the maximum")
  void shouldRaiseAboveTheMaximum() {
    UUID batchId = UUID.randomUUID();

    assertThatThrownBy(() -> monitor.check(batchId, 3, 10, 20.0))
        .isInstanceOfSatisfying(
            BatchThresholdExceededException.class,
            e -> {
              assertThat(e.getBatchId()).isEqualTo(batchId);
              assertThat(e.getFailed()).isEqualTo(3);
              assertThat(e.getTotal()).isEqualTo(10);
            });
    assertThat(meterRegistry.counter("batch.threshold.exceeded").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should treat an empty batch as error free")
  void shouldTreatEmptyBatchAsErrorFree() {
    assertThat(monitor.errorPercentage(0, 0)).isZero();
    assertThatCode(() -> monitor.check(UUID.randomUUID(), 0, 0, 0.0)).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("Should reject any failure when the maximum is zero")
  void shouldRejectAnyFailureWithZeroMaximum() {
    assertThatThrownBy(() -> monitor.check(UUID.randomUUID(), 1, 100, 0.0))
        .isInstanceOf(BatchThresholdExceededException.class);
  }

  @Test
  @DisplayName("Should know the outcome early once failures alone exceed the capacity share")
  void shouldDetectCertainExceedance() {
    assertThat(monitor.isExceedanceCertain(2, 10, 20.0)).isFalse();
    assertThat(monitor.isExceedanceCertain(3, 10, 20.0)).isTrue();
    assertThat(monitor.isExceedanceCertain(1, 0, 20.0)).isFalse();
  }
}
