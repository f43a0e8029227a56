package com.flamingo.inboundmail.api.dto.response;

import com.flamingo.inboundmail.domain.entity.Organization;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for organization data. The webhook secret is never returned. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationResponse {

  private UUID id;
  private String name;
  private String webhookEmail;
  private boolean active;
  private LocalDateTime createdAt;

  /** Creates an OrganizationResponse from an Organization entity. */
  public static OrganizationResponse fromEntity(Organization organization) {
    return OrganizationResponse.builder()
        .id(organization.getId())
        .name(organization.getName())
        .webhookEmail(organization.getWebhookEmail())
        .active(organization.isActive())
        .createdAt(organization.getCreatedAt())
        .build();
  }
}
