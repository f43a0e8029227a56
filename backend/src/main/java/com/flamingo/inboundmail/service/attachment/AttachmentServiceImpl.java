package com.flamingo.inboundmail.service.attachment;

import com.flamingo.inboundmail.api.dto.response.AttachmentResponse;
import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.entity.ExtractionJob;
import com.flamingo.inboundmail.domain.entity.ExtractionResult;
import com.flamingo.inboundmail.domain.repository.AttachmentRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionJobRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionResultRepository;
import com.flamingo.inboundmail.exception.AttachmentNotFoundException;
import com.flamingo.inboundmail.exception.ExtractionNotAvailableException;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of AttachmentService. */
@Service
@RequiredArgsConstructor
public class AttachmentServiceImpl implements AttachmentService {

  private final AttachmentRepository attachmentRepository;
  private final ExtractionJobRepository jobRepository;
  private final ExtractionResultRepository resultRepository;

  @Override
  @Transactional(readOnly = true)
  public AttachmentResponse getAttachment(UUID attachmentId) {
    Attachment attachment = findAttachment(attachmentId);
    ExtractionJob job = jobRepository.findByAttachmentId(attachmentId).orElse(null);
    return AttachmentResponse.fromEntity(attachment, job);
  }

  @Override
  @Transactional(readOnly = true)
  public ExtractionResult getExtractedText(UUID attachmentId) {
    findAttachment(attachmentId);

    Optional<ExtractionResult> result = resultRepository.findByAttachmentId(attachmentId);
    if (result.isPresent() && result.get().isSuccessful()) {
      return result.get();
    }
    if (result.isPresent()) {
      throw new ExtractionNotAvailableException(
          attachmentId, "Text extraction failed: " + result.get().getErrorKind());
    }
    if (jobRepository.findByAttachmentId(attachmentId).isEmpty()) {
      throw new ExtractionNotAvailableException(
          attachmentId, "Attachment is not a document that gets extracted");
    }
    throw new ExtractionNotAvailableException(attachmentId, "Text extraction has not finished");
  }

  private Attachment findAttachment(UUID attachmentId) {
    return attachmentRepository
        .findById(attachmentId)
        .orElseThrow(() -> new AttachmentNotFoundException(attachmentId));
  }
}
