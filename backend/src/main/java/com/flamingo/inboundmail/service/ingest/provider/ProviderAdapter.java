package com.flamingo.inboundmail.service.ingest.provider;

import com.flamingo.inboundmail.service.ingest.model.NormalizedEvent;
import java.util.List;
import java.util.UUID;

/**
 * Translates one email provider's webhook format into {@link NormalizedEvent}s.
 *
 * <p>Implementations are Spring beans picked up by {@link ProviderAdapterRegistry}. Adding a
 * provider means adding a bean; nothing upstream or downstream changes.
 */
public interface ProviderAdapter {

  /** Path segment the provider posts to, e.g. {@code mandrill}. */
  String providerId();

  /**
   * Verifies the request signature against the registered organization secrets. Runs before any
   * payload parsing.
   *
   * @return id of the organization whose secret produced the signature
   * @throws com.flamingo.inboundmail.exception.WebhookAuthenticationException if the signature is
   *     missing or matches no active organization
   */
  UUID verifySignature(WebhookRequest request);

  /**
   * Parses the request body into provider events.
   *
   * @throws com.flamingo.inboundmail.exception.MalformedPayloadException on structurally invalid
   *     input
   */
  ProviderPayload parsePayload(WebhookRequest request);

  /** Maps provider events to normalized events. Events that carry no message are skipped. */
  List<NormalizedEvent> mapToNormalizedEvents(ProviderPayload payload, UUID organizationId);

  /** Runs verification, parsing and mapping in that order. */
  default ParsedWebhook parse(WebhookRequest request) {
    UUID organizationId = verifySignature(request);
    ProviderPayload payload = parsePayload(request);
    if (payload.acknowledgementOnly()) {
      return ParsedWebhook.acknowledgement();
    }
    return ParsedWebhook.of(mapToNormalizedEvents(payload, organizationId));
  }
}
