package com.flamingo.inboundmail.service.pipeline.batch;

import com.flamingo.inboundmail.service.pipeline.queue.ClaimedJob;
import java.util.UUID;

/** A claimed job enrolled in a batch. */
public record BatchMember(
    UUID jobId, UUID attachmentId, String workerId, String claimToken, int attemptCount) {

  public static BatchMember of(ClaimedJob job) {
    return new BatchMember(
        job.jobId(), job.attachmentId(), job.workerId(), job.claimToken(), job.attemptCount());
  }
}
