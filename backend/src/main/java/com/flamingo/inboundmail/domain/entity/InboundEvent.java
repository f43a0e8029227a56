package com.flamingo.inboundmail.domain.entity;

import com.flamingo.inboundmail.domain.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An admitted inbound email event.
 *
 * <p>The row doubles as the idempotency record: the unique constraint on {@code (provider_id,
 * external_event_id)} is what rejects provider retries.
 */
@Entity
@Table(
    name = "inbound_events",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_inbound_events_provider_event",
            columnNames = {"provider_id", "external_event_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InboundEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "provider_id", nullable = false, length = 64)
  private String providerId;

  @Column(name = "external_event_id", nullable = false, length = 512)
  private String externalEventId;

  private UUID organizationId;

  private String eventType;

  @Column(length = 320)
  private String sender;

  @Column(length = 512)
  private String senderName;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> recipients = new ArrayList<>();

  @Column(length = 998)
  private String subject;

  @Column(columnDefinition = "TEXT")
  private String textBody;

  @Column(columnDefinition = "TEXT")
  private String htmlBody;

  @Column(nullable = false)
  private LocalDateTime receivedAt;

  @Column(nullable = false, updatable = false)
  private LocalDateTime admittedAt;

  @PrePersist
  protected void onCreate() {
    admittedAt = LocalDateTime.now();
  }
}
