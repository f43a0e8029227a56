package com.flamingo.inboundmail.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A file attached to an inbound event. Created at ingestion and never mutated afterwards. */
@Entity
@Table(
    name = "attachments",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_attachments_event_ordinal",
            columnNames = {"event_id", "ordinal"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Attachment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_id", nullable = false)
  private UUID eventId;

  /** Position of the attachment within its event. */
  @Column(nullable = false)
  private int ordinal;

  @Column(nullable = false)
  private String filename;

  @Column(nullable = false)
  private String mediaType;

  private long sizeBytes;

  @Column(nullable = false, length = 1024)
  private String storageRef;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
