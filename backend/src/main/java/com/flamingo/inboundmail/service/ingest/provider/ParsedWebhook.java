package com.flamingo.inboundmail.service.ingest.provider;

import com.flamingo.inboundmail.service.ingest.model.NormalizedEvent;
import java.util.List;

/**
 * Outcome of parsing a verified webhook: either events to ingest, or an acknowledgement-only
 * request such as a provider ping.
 */
public record ParsedWebhook(List<NormalizedEvent> events, boolean acknowledgementOnly) {

  public ParsedWebhook {
    events = events == null ? List.of() : List.copyOf(events);
  }

  public static ParsedWebhook of(List<NormalizedEvent> events) {
    return new ParsedWebhook(events, false);
  }

  public static ParsedWebhook acknowledgement() {
    return new ParsedWebhook(List.of(), true);
  }
}
