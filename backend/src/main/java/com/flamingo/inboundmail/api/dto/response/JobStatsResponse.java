package com.flamingo.inboundmail.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for extraction queue statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatsResponse {
  private long pending;
  private long inProgress;
  private long succeeded;
  private long failed;
  private int activeBatches;
  private int activeWorkers;
  private LocalDateTime timestamp;
}
