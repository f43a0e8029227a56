package com.flamingo.inboundmail.api.rest;

import com.flamingo.inboundmail.api.dto.request.CreateOrganizationRequest;
import com.flamingo.inboundmail.api.dto.request.UpdateOrganizationRequest;
import com.flamingo.inboundmail.api.dto.response.OrganizationResponse;
import com.flamingo.inboundmail.domain.entity.Organization;
import com.flamingo.inboundmail.service.organization.OrganizationService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for organization management. */
@RestController
@RequestMapping("/api/organizations")
@RequiredArgsConstructor
public class OrganizationController {

  private final OrganizationService organizationService;

  /** Registers an organization. */
  @PostMapping
  public ResponseEntity<OrganizationResponse> createOrganization(
      @Valid @RequestBody CreateOrganizationRequest request) {
    Organization organization = organizationService.createOrganization(request);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(OrganizationResponse.fromEntity(organization));
  }

  @GetMapping
  public ResponseEntity<List<OrganizationResponse>> getAllOrganizations() {
    List<OrganizationResponse> responses =
        organizationService.getAllOrganizations().stream()
            .map(OrganizationResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(responses);
  }

  @GetMapping("/{organizationId}")
  public ResponseEntity<OrganizationResponse> getOrganization(@PathVariable UUID organizationId) {
    return ResponseEntity.ok(
        OrganizationResponse.fromEntity(organizationService.getOrganization(organizationId)));
  }

  /** Updates the fields present in the body, e.g. to rotate the webhook secret. */
  @PatchMapping("/{organizationId}")
  public ResponseEntity<OrganizationResponse> updateOrganization(
      @PathVariable UUID organizationId, @Valid @RequestBody UpdateOrganizationRequest request) {
    Organization organization = organizationService.updateOrganization(organizationId, request);
    return ResponseEntity.ok(OrganizationResponse.fromEntity(organization));
  }

  /** Deactivates an organization; its events and attachments are kept. */
  @DeleteMapping("/{organizationId}")
  public ResponseEntity<Void> deactivateOrganization(@PathVariable UUID organizationId) {
    organizationService.deactivateOrganization(organizationId);
    return ResponseEntity.noContent().build();
  }
}
