package com.flamingo.inboundmail.domain.repository;

import com.flamingo.inboundmail.domain.entity.ExtractionResult;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ExtractionResult entities. */
@Repository
public interface ExtractionResultRepository extends JpaRepository<ExtractionResult, UUID> {

  Optional<ExtractionResult> findByJobId(UUID jobId);

  Optional<ExtractionResult> findByAttachmentId(UUID attachmentId);

  boolean existsByJobId(UUID jobId);

  long countByJobIdIn(Collection<UUID> jobIds);
}
