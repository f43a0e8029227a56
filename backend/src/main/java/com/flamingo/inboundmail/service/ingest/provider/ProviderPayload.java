package com.flamingo.inboundmail.service.ingest.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Structurally valid provider payload, one JSON node per provider event. */
public record ProviderPayload(List<JsonNode> events, boolean acknowledgementOnly) {

  public ProviderPayload {
    events = events == null ? List.of() : List.copyOf(events);
  }

  public static ProviderPayload of(List<JsonNode> events) {
    return new ProviderPayload(events, false);
  }

  public static ProviderPayload acknowledgement() {
    return new ProviderPayload(List.of(), true);
  }
}
