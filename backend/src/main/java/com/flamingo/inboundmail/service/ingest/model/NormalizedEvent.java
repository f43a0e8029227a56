package com.flamingo.inboundmail.service.ingest.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Provider-independent view of an inbound email event.
 *
 * <p>{@code (providerId, externalEventId)} is the idempotency key.
 */
public record NormalizedEvent(
    String providerId,
    String externalEventId,
    UUID organizationId,
    String eventType,
    LocalDateTime receivedAt,
    String sender,
    String senderName,
    List<String> recipients,
    String subject,
    List<BodyRef> bodyRefs,
    List<AttachmentRef> attachmentRefs) {

  public NormalizedEvent {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
    bodyRefs = bodyRefs == null ? List.of() : List.copyOf(bodyRefs);
    attachmentRefs = attachmentRefs == null ? List.of() : List.copyOf(attachmentRefs);
  }

  public String textBody() {
    return bodyRefs.stream().filter(BodyRef::isPlainText).map(BodyRef::content).findFirst()
        .orElse(null);
  }

  public String htmlBody() {
    return bodyRefs.stream().filter(BodyRef::isHtml).map(BodyRef::content).findFirst()
        .orElse(null);
  }
}
