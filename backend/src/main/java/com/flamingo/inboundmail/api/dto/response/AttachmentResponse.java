package com.flamingo.inboundmail.api.dto.response;

import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.entity.ExtractionJob;
import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.domain.enums.JobState;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an attachment and the state of its extraction job, if any. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentResponse {

  private UUID id;
  private UUID eventId;
  private int ordinal;
  private String filename;
  private String mediaType;
  private long sizeBytes;
  private LocalDateTime createdAt;

  private UUID jobId;
  private JobState jobState;
  private Integer attemptCount;
  private ErrorKind lastErrorKind;

  /** Creates an AttachmentResponse; {@code job} is null for attachments that are not extracted. */
  public static AttachmentResponse fromEntity(Attachment attachment, ExtractionJob job) {
    AttachmentResponseBuilder builder =
        AttachmentResponse.builder()
            .id(attachment.getId())
            .eventId(attachment.getEventId())
            .ordinal(attachment.getOrdinal())
            .filename(attachment.getFilename())
            .mediaType(attachment.getMediaType())
            .sizeBytes(attachment.getSizeBytes())
            .createdAt(attachment.getCreatedAt());
    if (job != null) {
      builder
          .jobId(job.getId())
          .jobState(job.getState())
          .attemptCount(job.getAttemptCount())
          .lastErrorKind(job.getLastErrorKind());
    }
    return builder.build();
  }
}
