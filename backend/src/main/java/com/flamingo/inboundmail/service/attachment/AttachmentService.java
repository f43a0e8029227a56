package com.flamingo.inboundmail.service.attachment;

import com.flamingo.inboundmail.api.dto.response.AttachmentResponse;
import com.flamingo.inboundmail.domain.entity.ExtractionResult;
import java.util.UUID;

/** Read access to stored attachments and their extracted text. */
public interface AttachmentService {

  /**
   * @throws com.flamingo.inboundmail.exception.AttachmentNotFoundException if absent
   */
  AttachmentResponse getAttachment(UUID attachmentId);

  /**
   * Returns the committed extraction result of an attachment.
   *
   * @throws com.flamingo.inboundmail.exception.AttachmentNotFoundException if absent
   * @throws com.flamingo.inboundmail.exception.ExtractionNotAvailableException if the attachment
   *     is not extracted, not extracted yet, or its extraction failed
   */
  ExtractionResult getExtractedText(UUID attachmentId);
}
