package com.flamingo.inboundmail.service.ingest;

import com.flamingo.inboundmail.domain.entity.InboundEvent;
import com.flamingo.inboundmail.domain.repository.InboundEventRepository;
import com.flamingo.inboundmail.exception.IngestionPersistenceException;
import com.flamingo.inboundmail.service.ingest.model.NormalizedEvent;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Admits each {@code (providerId, externalEventId)} at most once.
 *
 * <p>Admission is the insert itself; the unique constraint decides. There is no lookup beforehand,
 * so two concurrent deliveries of the same event cannot both pass. Only a violation of that
 * constraint counts as a duplicate; any other integrity error is a storage failure.
 */
@Component
@Slf4j
public class EventDeduplicator {

  static final String UNIQUE_CONSTRAINT = "uk_inbound_events_provider_event";

  private final InboundEventRepository eventRepository;
  private final TransactionTemplate lookupTransaction;

  public EventDeduplicator(
      InboundEventRepository eventRepository, PlatformTransactionManager transactionManager) {
    this.eventRepository = eventRepository;
    this.lookupTransaction = new TransactionTemplate(transactionManager);
    this.lookupTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.lookupTransaction.setReadOnly(true);
  }

  /**
   * Inserts the idempotency record for the event. Must run inside the caller's transaction; on a
   * duplicate that transaction is no longer usable and has to be rolled back.
   *
   * @return the admitted event, or empty if the event was admitted before
   * @throws IngestionPersistenceException on any other storage failure
   */
  public Optional<InboundEvent> admit(NormalizedEvent event) {
    InboundEvent record =
        InboundEvent.builder()
            .providerId(event.providerId())
            .externalEventId(event.externalEventId())
            .organizationId(event.organizationId())
            .eventType(event.eventType())
            .sender(event.sender())
            .senderName(event.senderName())
            .recipients(new ArrayList<>(event.recipients()))
            .subject(event.subject())
            .textBody(event.textBody())
            .htmlBody(event.htmlBody())
            .receivedAt(event.receivedAt())
            .build();
    try {
      return Optional.of(eventRepository.saveAndFlush(record));
    } catch (DataIntegrityViolationException e) {
      if (!isDuplicate(event, e)) {
        throw new IngestionPersistenceException(
            "Failed to admit event " + event.externalEventId(), e);
      }
      log.info("Duplicate {} event {} ignored", event.providerId(), event.externalEventId());
      return Optional.empty();
    } catch (DataAccessException e) {
      throw new IngestionPersistenceException(
          "Failed to admit event " + event.externalEventId(), e);
    }
  }

  private boolean isDuplicate(NormalizedEvent event, DataIntegrityViolationException e) {
    ConstraintViolationException violation = findConstraintViolation(e);
    if (violation == null) {
      // value too long, bad data: never a duplicate
      return false;
    }
    String constraint = violation.getConstraintName();
    if (constraint != null
        && constraint.toLowerCase(Locale.ROOT).contains(UNIQUE_CONSTRAINT)) {
      return true;
    }
    // Some drivers report no constraint name; the committed row is the authority then
    return isAlreadyAdmitted(event);
  }

  private boolean isAlreadyAdmitted(NormalizedEvent event) {
    try {
      Long count =
          lookupTransaction.execute(
              status ->
                  eventRepository.countByProviderIdAndExternalEventId(
                      event.providerId(), event.externalEventId()));
      return count != null && count > 0;
    } catch (DataAccessException e) {
      throw new IngestionPersistenceException(
          "Failed to check event " + event.externalEventId(), e);
    }
  }

  private static ConstraintViolationException findConstraintViolation(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof ConstraintViolationException violation) {
        return violation;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return null;
  }
}
