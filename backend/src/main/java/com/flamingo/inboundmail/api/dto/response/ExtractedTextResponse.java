package com.flamingo.inboundmail.api.dto.response;

import com.flamingo.inboundmail.domain.entity.ExtractionResult;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the text extracted from an attachment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedTextResponse {

  private UUID attachmentId;
  private UUID jobId;
  private String text;
  private Integer pageCount;
  private Integer characterCount;
  private LocalDateTime completedAt;

  public static ExtractedTextResponse fromEntity(ExtractionResult result) {
    return ExtractedTextResponse.builder()
        .attachmentId(result.getAttachmentId())
        .jobId(result.getJobId())
        .text(result.getText())
        .pageCount(result.getPageCount())
        .characterCount(result.getCharacterCount())
        .completedAt(result.getCompletedAt())
        .build();
  }
}
