package com.flamingo.inboundmail.service.pipeline.batch;

import java.util.UUID;

/** Handle a worker holds for the batch its job was enrolled in. */
public record BatchTicket(BatchAccumulator batch, BatchMember member) {

  public UUID batchId() {
    return batch.getId();
  }

  /** True once the batch has been aborted; the worker should stop without persisting. */
  public boolean isAborted() {
    return batch.isAborted();
  }
}
