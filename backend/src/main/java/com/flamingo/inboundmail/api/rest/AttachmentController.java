package com.flamingo.inboundmail.api.rest;

import com.flamingo.inboundmail.api.dto.response.AttachmentResponse;
import com.flamingo.inboundmail.api.dto.response.ExtractedTextResponse;
import com.flamingo.inboundmail.service.attachment.AttachmentService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for stored attachments and their extracted text. */
@RestController
@RequestMapping("/api/attachments")
@RequiredArgsConstructor
public class AttachmentController {

  private final AttachmentService attachmentService;

  @GetMapping("/{attachmentId}")
  public ResponseEntity<AttachmentResponse> getAttachment(@PathVariable UUID attachmentId) {
    return ResponseEntity.ok(attachmentService.getAttachment(attachmentId));
  }

  /** Returns the extracted text; 409 while extraction is pending or after it failed. */
  @GetMapping("/{attachmentId}/text")
  public ResponseEntity<ExtractedTextResponse> getExtractedText(@PathVariable UUID attachmentId) {
    return ResponseEntity.ok(
        ExtractedTextResponse.fromEntity(attachmentService.getExtractedText(attachmentId)));
  }
}
