package com.flamingo.inboundmail.service.ingest.provider.mandrill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.inboundmail.exception.MalformedPayloadException;
import com.flamingo.inboundmail.service.ingest.model.NormalizedEvent;
import com.flamingo.inboundmail.service.ingest.provider.ProviderAdapter;
import com.flamingo.inboundmail.service.ingest.provider.ProviderPayload;
import com.flamingo.inboundmail.service.ingest.provider.WebhookRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link ProviderAdapter} for Mandrill inbound webhooks.
 *
 * <p>Mandrill posts form data whose {@code mandrill_events} field holds a JSON array of events.
 * Some relays forward the array, or a single event, as a JSON body instead; both are accepted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MandrillProviderAdapter implements ProviderAdapter {

  public static final String PROVIDER_ID = "mandrill";

  private static final List<String> EVENT_FIELDS =
      List.of("mandrill_events", "events", "data", "payload", "webhook");
  private static final String PING = "ping";

  private final MandrillSignatureVerifier signatureVerifier;
  private final MandrillEventMapper eventMapper;
  private final ObjectMapper objectMapper;

  @Override
  public String providerId() {
    return PROVIDER_ID;
  }

  @Override
  public UUID verifySignature(WebhookRequest request) {
    return signatureVerifier.identifyOrganization(request).getId();
  }

  @Override
  public ProviderPayload parsePayload(WebhookRequest request) {
    JsonNode root = readJson(eventsJson(request));

    if (root.isArray()) {
      if (root.isEmpty() || isPing(root.get(0))) {
        return ProviderPayload.acknowledgement();
      }
      List<JsonNode> events = new ArrayList<>(root.size());
      for (JsonNode event : root) {
        if (!event.isObject()) {
          throw new MalformedPayloadException(PROVIDER_ID, "Event is not a JSON object");
        }
        events.add(event);
      }
      return ProviderPayload.of(events);
    }
    if (root.isObject()) {
      return isPing(root) ? ProviderPayload.acknowledgement() : ProviderPayload.of(List.of(root));
    }
    throw new MalformedPayloadException(PROVIDER_ID, "Events must be a JSON array or object");
  }

  @Override
  public List<NormalizedEvent> mapToNormalizedEvents(
      ProviderPayload payload, UUID organizationId) {
    List<NormalizedEvent> events = new ArrayList<>();
    for (JsonNode event : payload.events()) {
      eventMapper.map(event, organizationId).ifPresent(events::add);
    }
    log.debug("Mapped {} of {} Mandrill events", events.size(), payload.events().size());
    return events;
  }

  private String eventsJson(WebhookRequest request) {
    if (request.isFormEncoded()) {
      Map<String, String> form = request.formParameters();
      for (String field : EVENT_FIELDS) {
        String value = form.get(field);
        if (value != null && !value.isBlank()) {
          return value;
        }
      }
      throw new MalformedPayloadException(PROVIDER_ID, "Form body has no mandrill_events field");
    }
    String body = request.bodyAsString();
    if (body.isBlank()) {
      throw new MalformedPayloadException(PROVIDER_ID, "Empty webhook body");
    }
    return body;
  }

  private JsonNode readJson(String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new MalformedPayloadException(PROVIDER_ID, "Events are not valid JSON", e);
    }
  }

  private static boolean isPing(JsonNode node) {
    return node != null
        && node.isObject()
        && (PING.equals(node.path("type").asText()) || PING.equals(node.path("event").asText()));
  }
}
