package com.flamingo.inboundmail.service.ingest;

import com.flamingo.inboundmail.service.ingest.provider.WebhookRequest;

/** Service interface for ingesting provider webhooks. */
public interface WebhookIngestionService {

  /**
   * Verifies, parses, deduplicates and stores a webhook delivery, enqueueing extraction jobs for
   * its PDF attachments. Does no extraction itself.
   *
   * @param providerId provider path segment
   * @param request raw request
   * @return counts of admitted and duplicate events
   * @throws com.flamingo.inboundmail.exception.ProviderNotFoundException for an unknown provider
   * @throws com.flamingo.inboundmail.exception.WebhookAuthenticationException on a bad signature
   * @throws com.flamingo.inboundmail.exception.MalformedPayloadException on an invalid body
   * @throws com.flamingo.inboundmail.exception.IngestionPersistenceException on storage failure
   */
  IngestionResult ingest(String providerId, WebhookRequest request);
}
