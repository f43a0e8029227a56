package com.flamingo.inboundmail.api.rest;

import com.flamingo.inboundmail.api.dto.response.BatchRunResponse;
import com.flamingo.inboundmail.api.dto.response.JobStatsResponse;
import com.flamingo.inboundmail.service.pipeline.PipelineQueryService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing extraction queue and batch state. */
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

  private final PipelineQueryService pipelineQueryService;

  @GetMapping("/batches")
  public ResponseEntity<List<BatchRunResponse>> getRecentBatches(
      @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(pipelineQueryService.getRecentBatches(limit));
  }

  @GetMapping("/jobs/stats")
  public ResponseEntity<JobStatsResponse> getJobStats() {
    return ResponseEntity.ok(pipelineQueryService.getJobStats());
  }
}
