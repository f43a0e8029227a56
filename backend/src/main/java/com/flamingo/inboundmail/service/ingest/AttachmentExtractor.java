package com.flamingo.inboundmail.service.ingest;

import com.flamingo.inboundmail.domain.entity.Attachment;
import com.flamingo.inboundmail.domain.entity.InboundEvent;
import com.flamingo.inboundmail.domain.repository.AttachmentRepository;
import com.flamingo.inboundmail.service.ingest.model.AttachmentRef;
import com.flamingo.inboundmail.service.ingest.model.NormalizedEvent;
import com.flamingo.inboundmail.service.pipeline.queue.JobQueue;
import com.flamingo.inboundmail.service.storage.AttachmentStorage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stores the attachments of an admitted event and enqueues one extraction job per PDF.
 *
 * <p>Safe to run again for the same event: attachments are reused by position and the job queue
 * returns the existing job for an attachment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttachmentExtractor {

  private static final int MAX_FILENAME_LENGTH = 120;

  private final AttachmentRepository attachmentRepository;
  private final AttachmentStorage attachmentStorage;
  private final MediaTypeClassifier mediaTypeClassifier;
  private final JobQueue jobQueue;

  /** Runs inside the ingestion transaction of the event. */
  public List<Attachment> extract(InboundEvent admitted, NormalizedEvent event) {
    List<Attachment> attachments = new ArrayList<>();
    List<AttachmentRef> refs = event.attachmentRefs();

    for (int ordinal = 0; ordinal < refs.size(); ordinal++) {
      AttachmentRef ref = refs.get(ordinal);
      Attachment attachment = findOrStore(admitted, ordinal, ref);
      attachments.add(attachment);

      if (mediaTypeClassifier.isExtractable(attachment.getMediaType())) {
        jobQueue.enqueue(attachment);
      } else {
        log.debug(
            "Attachment {} ({}) is not extractable", attachment.getFilename(),
            attachment.getMediaType());
      }
    }

    if (!attachments.isEmpty()) {
      log.info("Event {} has {} attachments", admitted.getExternalEventId(), attachments.size());
    }
    return attachments;
  }

  private Attachment findOrStore(InboundEvent admitted, int ordinal, AttachmentRef ref) {
    Optional<Attachment> existing =
        attachmentRepository.findByEventIdAndOrdinal(admitted.getId(), ordinal);
    if (existing.isPresent()) {
      return existing.get();
    }

    String filename = ref.filename();
    String mediaType = mediaTypeClassifier.classify(filename, ref.declaredMediaType());
    String key = admitted.getId() + "/" + ordinal + "_" + safeFilename(filename);
    String storageRef = attachmentStorage.store(key, ref.content());

    return attachmentRepository.save(
        Attachment.builder()
            .eventId(admitted.getId())
            .ordinal(ordinal)
            .filename(filename)
            .mediaType(mediaType)
            .sizeBytes(ref.sizeBytes())
            .storageRef(storageRef)
            .build());
  }

  static String safeFilename(String filename) {
    String safe = filename.replaceAll("[^A-Za-z0-9._-]", "_");
    if (safe.startsWith(".")) {
      safe = "_" + safe;
    }
    return safe.length() > MAX_FILENAME_LENGTH
        ? safe.substring(safe.length() - MAX_FILENAME_LENGTH)
        : safe;
  }
}
