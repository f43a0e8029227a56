package com.flamingo.inboundmail.service.pipeline.queue;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A job held by one worker.
 *
 * @param claimToken unique to this claim; a later claim of the same job gets a new one
 * @param attemptCount attempts consumed including this one
 */
public record ClaimedJob(
    UUID jobId,
    UUID attachmentId,
    String workerId,
    String claimToken,
    int attemptCount,
    LocalDateTime leaseExpiresAt) {}
