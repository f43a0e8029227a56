package com.flamingo.inboundmail.api.dto.response;

import com.flamingo.inboundmail.domain.entity.BatchRun;
import com.flamingo.inboundmail.domain.enums.BatchOutcome;
import com.flamingo.inboundmail.domain.enums.CommitMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a closed batch. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRunResponse {

  private UUID id;
  private CommitMode commitMode;
  private BatchOutcome outcome;
  private int total;
  private int succeeded;
  private int failed;
  private int cancelled;
  private double errorPercentage;
  private double maxErrorPercentage;
  private boolean abortedEarly;
  private List<UUID> jobIds;
  private LocalDateTime openedAt;
  private LocalDateTime closedAt;

  public static BatchRunResponse fromEntity(BatchRun run) {
    return BatchRunResponse.builder()
        .id(run.getId())
        .commitMode(run.getCommitMode())
        .outcome(run.getOutcome())
        .total(run.getTotal())
        .succeeded(run.getSucceeded())
        .failed(run.getFailed())
        .cancelled(run.getCancelled())
        .errorPercentage(run.errorPercentage())
        .maxErrorPercentage(run.getMaxErrorPercentage())
        .abortedEarly(run.isAbortedEarly())
        .jobIds(List.copyOf(run.getJobIds()))
        .openedAt(run.getOpenedAt())
        .closedAt(run.getClosedAt())
        .build();
  }
}
