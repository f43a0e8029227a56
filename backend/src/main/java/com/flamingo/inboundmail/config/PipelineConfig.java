package com.flamingo.inboundmail.config;

import com.flamingo.inboundmail.domain.enums.CommitMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Validated
@Getter
@Setter
public class PipelineConfig {

  /** Maximum number of jobs in one batch. */
  @Min(1)
  private int batchCommitSize = 10;

  /** Commit a batch's results in one transaction instead of one by one. */
  private boolean useSingleTransaction = false;

  /** Largest failed share of a batch, in percent, that still counts as a success. */
  @DecimalMin("0.0")
  @DecimalMax("100.0")
  private double maxErrorPercentage = 20.0;

  @Min(1)
  private int jobMaxAttempts = 3;

  @Min(1)
  private int jobClaimLeaseSeconds = 300;

  /** A batch that has not filled up is closed after this many seconds. */
  @Min(1)
  private int batchFlushTimeoutSeconds = 30;

  private Worker worker = new Worker();

  public CommitMode commitMode() {
    return useSingleTransaction ? CommitMode.SINGLE_TRANSACTION : CommitMode.PER_ITEM;
  }

  public Duration claimLease() {
    return Duration.ofSeconds(jobClaimLeaseSeconds);
  }

  public Duration batchFlushTimeout() {
    return Duration.ofSeconds(batchFlushTimeoutSeconds);
  }

  @Getter
  @Setter
  public static class Worker {
    @Min(1)
    private int concurrency = 4;

    /** Start the worker pool with the application context. */
    private boolean autoStart = true;

    /** Per-job bound on a single OCR call. */
    @Min(1)
    private int ocrTimeoutSeconds = 120;

    /** How long a worker blocks waiting for a claimable job before looping. */
    @Min(1)
    private long claimWaitMillis = 5000;

    /** Poll interval while blocked on claim, covers jobs enqueued by other processes. */
    @Min(1)
    private long pollIntervalMillis = 1000;

    /** How often a worker waiting on OCR checks whether its batch was aborted. */
    @Min(1)
    private long abortCheckIntervalMillis = 200;

    @Min(100)
    private long leaseReaperIntervalMillis = 15000;

    @Min(100)
    private long batchFlushCheckIntervalMillis = 1000;

    public Duration ocrTimeout() {
      return Duration.ofSeconds(ocrTimeoutSeconds);
    }

    public Duration claimWait() {
      return Duration.ofMillis(claimWaitMillis);
    }
  }
}
