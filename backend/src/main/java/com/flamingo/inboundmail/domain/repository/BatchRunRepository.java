package com.flamingo.inboundmail.domain.repository;

import com.flamingo.inboundmail.domain.entity.BatchRun;
import com.flamingo.inboundmail.domain.enums.BatchOutcome;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for BatchRun entities. */
@Repository
public interface BatchRunRepository extends JpaRepository<BatchRun, UUID> {

  List<BatchRun> findAllByOrderByClosedAtDesc(Pageable pageable);

  long countByOutcome(BatchOutcome outcome);
}
