package com.flamingo.inboundmail.service.organization;

import com.flamingo.inboundmail.api.dto.request.CreateOrganizationRequest;
import com.flamingo.inboundmail.api.dto.request.UpdateOrganizationRequest;
import com.flamingo.inboundmail.domain.entity.Organization;
import java.util.List;
import java.util.UUID;

/** Service interface for managing webhook-receiving organizations. */
public interface OrganizationService {

  /**
   * Registers an organization and its webhook secret.
   *
   * @throws com.flamingo.inboundmail.exception.DuplicateOrganizationException if the name is taken
   */
  Organization createOrganization(CreateOrganizationRequest request);

  /**
   * @throws com.flamingo.inboundmail.exception.OrganizationNotFoundException if absent
   */
  Organization getOrganization(UUID organizationId);

  List<Organization> getAllOrganizations();

  /**
   * Applies the fields present in the request. Replacing the webhook secret takes effect for the
   * next delivery.
   *
   * @throws com.flamingo.inboundmail.exception.DuplicateOrganizationException if the new name is
   *     taken by another organization
   */
  Organization updateOrganization(UUID organizationId, UpdateOrganizationRequest request);

  /**
   * Deactivates an organization. Its secret no longer authenticates webhooks; stored events are
   * kept.
   */
  Organization deactivateOrganization(UUID organizationId);
}
