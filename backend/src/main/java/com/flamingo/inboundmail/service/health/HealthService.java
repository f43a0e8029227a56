package com.flamingo.inboundmail.service.health;

import com.flamingo.inboundmail.api.dto.response.SystemStats;

/** Service interface for health checks and system statistics. */
public interface HealthService {

  /**
   * Gets system-wide statistics including organizations, events, attachments and batches.
   *
   * @return system statistics
   */
  SystemStats getSystemStats();
}
