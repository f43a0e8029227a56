package com.flamingo.inboundmail.service.pipeline;

import com.flamingo.inboundmail.api.dto.response.BatchRunResponse;
import com.flamingo.inboundmail.api.dto.response.JobStatsResponse;
import com.flamingo.inboundmail.domain.enums.JobState;
import com.flamingo.inboundmail.domain.repository.BatchRunRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionJobRepository;
import com.flamingo.inboundmail.service.pipeline.batch.BatchCommitter;
import com.flamingo.inboundmail.service.pipeline.worker.WorkerPool;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of PipelineQueryService. */
@Service
@RequiredArgsConstructor
public class PipelineQueryServiceImpl implements PipelineQueryService {

  private static final int MAX_LIMIT = 200;

  private final BatchRunRepository batchRunRepository;
  private final ExtractionJobRepository jobRepository;
  private final BatchCommitter batchCommitter;
  private final WorkerPool workerPool;
  private final Clock clock;

  @Override
  @Transactional(readOnly = true)
  public List<BatchRunResponse> getRecentBatches(int limit) {
    int size = Math.max(1, Math.min(limit, MAX_LIMIT));
    return batchRunRepository.findAllByOrderByClosedAtDesc(PageRequest.of(0, size)).stream()
        .map(BatchRunResponse::fromEntity)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public JobStatsResponse getJobStats() {
    return JobStatsResponse.builder()
        .pending(jobRepository.countByState(JobState.PENDING))
        .inProgress(jobRepository.countByState(JobState.IN_PROGRESS))
        .succeeded(jobRepository.countByState(JobState.SUCCEEDED))
        .failed(jobRepository.countByState(JobState.FAILED))
        .activeBatches(batchCommitter.activeBatchCount())
        .activeWorkers(workerPool.activeWorkers())
        .timestamp(LocalDateTime.now(clock))
        .build();
  }
}
