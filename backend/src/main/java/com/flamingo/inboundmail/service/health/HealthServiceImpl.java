package com.flamingo.inboundmail.service.health;

import com.flamingo.inboundmail.api.dto.response.SystemStats;
import com.flamingo.inboundmail.domain.repository.AttachmentRepository;
import com.flamingo.inboundmail.domain.repository.BatchRunRepository;
import com.flamingo.inboundmail.domain.repository.ExtractionResultRepository;
import com.flamingo.inboundmail.domain.repository.InboundEventRepository;
import com.flamingo.inboundmail.domain.repository.OrganizationRepository;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of HealthService for system health checks and statistics. */
@Service
@RequiredArgsConstructor
public class HealthServiceImpl implements HealthService {

  private final OrganizationRepository organizationRepository;
  private final InboundEventRepository eventRepository;
  private final AttachmentRepository attachmentRepository;
  private final ExtractionResultRepository resultRepository;
  private final BatchRunRepository batchRunRepository;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    return SystemStats.builder()
        .totalOrganizations(organizationRepository.count())
        .totalEvents(eventRepository.count())
        .totalAttachments(attachmentRepository.count())
        .totalResults(resultRepository.count())
        .totalBatchRuns(batchRunRepository.count())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
