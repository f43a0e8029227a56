package com.flamingo.inboundmail.service.ingest;

import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.entity.InboundEvent;
import com.flamingo.inboundmail.exception.AttachmentStorageException;
import com.flamingo.inboundmail.exception.IngestionPersistenceException;
import com.flamingo.inboundmail.service.ingest.model.NormalizedEvent;
import com.flamingo.inboundmail.service.ingest.provider.ParsedWebhook;
import com.flamingo.inboundmail.service.ingest.provider.ProviderAdapter;
import com.flamingo.inboundmail.service.ingest.provider.ProviderAdapterRegistry;
import com.flamingo.inboundmail.service.ingest.provider.WebhookRequest;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Implementation of the WebhookIngestionService.
 *
 * <p>Each event is admitted and extracted in its own transaction, so a duplicate in a multi-event
 * delivery does not roll back its siblings.
 */
@Service
@Slf4j
public class WebhookIngestionServiceImpl implements WebhookIngestionService {

  private final ProviderAdapterRegistry adapterRegistry;
  private final EventDeduplicator eventDeduplicator;
  private final AttachmentExtractor attachmentExtractor;
  private final TransactionTemplate transactionTemplate;
  private final MeterRegistry meterRegistry;

  public WebhookIngestionServiceImpl(
      ProviderAdapterRegistry adapterRegistry,
      EventDeduplicator eventDeduplicator,
      AttachmentExtractor attachmentExtractor,
      PlatformTransactionManager transactionManager,
      MeterRegistry meterRegistry) {
    this.adapterRegistry = adapterRegistry;
    this.eventDeduplicator = eventDeduplicator;
    this.attachmentExtractor = attachmentExtractor;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "webhook.ingest", description = "Time to ingest a webhook delivery")
  public IngestionResult ingest(String providerId, WebhookRequest request) {
    ProviderAdapter adapter = adapterRegistry.route(providerId);
    ParsedWebhook parsed = adapter.parse(request);

    if (parsed.acknowledgementOnly()) {
      log.info("Acknowledged {} validation request", adapter.providerId());
      meterRegistry.counter("webhook.events", "provider", providerId, "result", "ping")
          .increment();
      return IngestionResult.acknowledgement();
    }

    int admitted = 0;
    int duplicates = 0;
    int jobs = 0;
    for (NormalizedEvent event : parsed.events()) {
      Optional<Integer> enqueued = ingestEvent(event);
      if (enqueued.isPresent()) {
        admitted++;
        jobs += enqueued.get();
      } else {
        duplicates++;
      }
    }

    meterRegistry.counter("webhook.events", "provider", providerId, "result", "admitted")
        .increment(admitted);
    meterRegistry.counter("webhook.events", "provider", providerId, "result", "duplicate")
        .increment(duplicates);
    log.info(
        "{} webhook: {} admitted, {} duplicate, {} jobs enqueued",
        providerId,
        admitted,
        duplicates,
        jobs);
    return new IngestionResult(admitted, duplicates, jobs);
  }

  /** Returns the number of jobs enqueued, or empty for a duplicate. */
  private Optional<Integer> ingestEvent(NormalizedEvent event) {
    try {
      return transactionTemplate.execute(
          status -> {
            Optional<InboundEvent> admitted = eventDeduplicator.admit(event);
            if (admitted.isEmpty()) {
              status.setRollbackOnly();
              return Optional.<Integer>empty();
            }
            List<Attachment> attachments = attachmentExtractor.extract(admitted.get(), event);
            return Optional.of(countExtractable(attachments));
          });
    } catch (DataAccessException | AttachmentStorageException e) {
      throw new IngestionPersistenceException(
          "Failed to store event " + event.externalEventId(), e);
    }
  }

  private int countExtractable(List<Attachment> attachments) {
    return (int)
        attachments.stream()
            .filter(attachment -> MediaTypeClassifier.PDF.equals(attachment.getMediaType()))
            .count();
  }
}
