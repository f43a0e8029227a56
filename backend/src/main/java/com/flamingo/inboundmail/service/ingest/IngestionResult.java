package com.flamingo.inboundmail.service.ingest;

/**
 * Summary of one webhook delivery.
 *
 * @param admitted events stored for the first time
 * @param duplicates events already admitted by an earlier delivery
 * @param jobsEnqueued extraction jobs created for admitted events
 */
public record IngestionResult(int admitted, int duplicates, int jobsEnqueued) {

  public static final String ACCEPTED = "accepted";
  public static final String IGNORED = "ignored";

  public static IngestionResult acknowledgement() {
    return new IngestionResult(0, 0, 0);
  }

  /** {@code accepted} when at least one event was newly admitted, {@code ignored} otherwise. */
  public String status() {
    return admitted > 0 ? ACCEPTED : IGNORED;
  }
}
