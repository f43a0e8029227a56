package com.flamingo.inboundmail.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for system-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private long totalOrganizations;
  private long totalEvents;
  private long totalAttachments;
  private long totalResults;
  private long totalBatchRuns;
  private LocalDateTime timestamp;
}
