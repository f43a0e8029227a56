package com.flamingo.inboundmail.service.pipeline;

import com.flamingo.inboundmail.api.dto.response.BatchRunResponse;
import com.flamingo.inboundmail.api.dto.response.JobStatsResponse;
import java.util.List;

/** Read-only view of the extraction queue and closed batches. */
public interface PipelineQueryService {

  /** Most recently closed batches first. */
  List<BatchRunResponse> getRecentBatches(int limit);

  JobStatsResponse getJobStats();
}
