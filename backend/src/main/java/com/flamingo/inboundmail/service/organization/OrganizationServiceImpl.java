package com.flamingo.inboundmail.service.organization;

import com.flamingo.inboundmail.api.dto.request.CreateOrganizationRequest;
import com.flamingo.inboundmail.api.dto.request.UpdateOrganizationRequest;
import com.flamingo.inboundmail.domain.entity.Organization;
import com.flamingo.inboundmail.domain.repository.OrganizationRepository;
import com.flamingo.inboundmail.exception.DuplicateOrganizationException;
import com.flamingo.inboundmail.exception.OrganizationNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the OrganizationService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrganizationServiceImpl implements OrganizationService {

  private final OrganizationRepository organizationRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "organization.create", description = "Time to create an organization")
  public Organization createOrganization(CreateOrganizationRequest request) {
    String name = request.getName().trim();
    log.info("Creating organization: {}", name);

    if (organizationRepository.existsByName(name)) {
      throw new DuplicateOrganizationException(name);
    }

    Organization organization =
        Organization.builder()
            .name(name)
            .webhookEmail(request.getWebhookEmail())
            .mandrillWebhookSecret(request.getMandrillWebhookSecret())
            .build();

    Organization saved = organizationRepository.save(organization);
    meterRegistry.counter("organization.created").increment();

    log.info("Created organization with ID: {}", saved.getId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Organization getOrganization(UUID organizationId) {
    return organizationRepository
        .findById(organizationId)
        .orElseThrow(() -> new OrganizationNotFoundException(organizationId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Organization> getAllOrganizations() {
    return organizationRepository.findAllByOrderByCreatedAtAsc();
  }

  @Override
  @Transactional
  @Timed(value = "organization.update", description = "Time to update an organization")
  public Organization updateOrganization(UUID organizationId, UpdateOrganizationRequest request) {
    Organization organization = getOrganization(organizationId);

    if (request.getName() != null) {
      String name = request.getName().trim();
      if (!name.equals(organization.getName()) && organizationRepository.existsByName(name)) {
        throw new DuplicateOrganizationException(name);
      }
      organization.setName(name);
    }
    if (request.getWebhookEmail() != null) {
      organization.setWebhookEmail(request.getWebhookEmail());
    }
    if (request.getMandrillWebhookSecret() != null) {
      organization.setMandrillWebhookSecret(request.getMandrillWebhookSecret());
      log.info("Rotated webhook secret of organization {}", organizationId);
      meterRegistry.counter("organization.secret.rotated").increment();
    }
    if (request.getActive() != null) {
      organization.setActive(request.getActive());
    }

    return organizationRepository.save(organization);
  }

  @Override
  @Transactional
  @Timed(value = "organization.deactivate", description = "Time to deactivate an organization")
  public Organization deactivateOrganization(UUID organizationId) {
    Organization organization = getOrganization(organizationId);
    if (organization.isActive()) {
      organization.deactivate();
      organizationRepository.save(organization);
      log.info("Deactivated organization {}", organizationId);
    }
    return organization;
  }
}
