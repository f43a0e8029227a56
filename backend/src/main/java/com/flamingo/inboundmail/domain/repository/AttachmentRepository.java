package com.flamingo.inboundmail.domain.repository;

import com.flamingo.inboundmail.domain.entity.Attachment;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Attachment entities. */
@Repository
public interface AttachmentRepository extends JpaRepository<Attachment, UUID> {

  List<Attachment> findByEventIdOrderByOrdinalAsc(UUID eventId);

  Optional<Attachment> findByEventIdAndOrdinal(UUID eventId, int ordinal);
}
