package com.flamingo.inboundmail.service.organization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.inboundmail.api.dto.request.CreateOrganizationRequest;
import com.flamingo.inboundmail.api.dto.request.UpdateOrganizationRequest;
import com.flamingo.inboundmail.domain.entity.Organization;
import com.flamingo.inboundmail.domain.repository.OrganizationRepository;
import com.flamingo.inboundmail.exception.DuplicateOrganizationException;
import com.flamingo.inboundmail.exception.OrganizationNotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrganizationServiceImplTest {

  @Mock private OrganizationRepository organizationRepository;

  @Mock private MeterRegistry meterRegistry;

  @Mock private Counter counter;

  private OrganizationServiceImpl organizationService;

  @BeforeEach
  void setUp() {
    organizationService = new OrganizationServiceImpl(organizationRepository, meterRegistry);
    when(meterRegistry.counter(any(String.class))).thenReturn(counter);
  }

  @Test
  void shouldCreateOrganization_whenNameIsFree() {
    // Given
    CreateOrganizationRequest request =
        CreateOrganizationRequest.builder()
            .name("  Acme  ")
            .webhookEmail("inbound@acme.test")
            .mandrillWebhookSecret("s3cret")
            .build();
    when(organizationRepository.existsByName("Acme")).thenReturn(false);
    when(organizationRepository.save(any(Organization.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    // When
    Organization result = organizationService.createOrganization(request);

    // Then
    ArgumentCaptor<Organization> captor = ArgumentCaptor.forClass(Organization.class);
    verify(organizationRepository).save(captor.capture());
    assertThat(captor.getValue().getName()).isEqualTo("Acme");
    assertThat(captor.getValue().getMandrillWebhookSecret()).isEqualTo("s3cret");
    assertThat(result.isActive()).isTrue();
    verify(counter).increment();
  }

  @Test
  void shouldRejectOrganization_whenNameTaken() {
    // Given
    CreateOrganizationRequest request =
        CreateOrganizationRequest.builder().name("Acme").mandrillWebhookSecret("x").build();
    when(organizationRepository.existsByName("Acme")).thenReturn(true);

    // When / Then
    assertThatThrownBy(() -> organizationService.createOrganization(request))
        .isInstanceOf(DuplicateOrganizationException.class);
    verify(organizationRepository, never()).save(any());
  }

  @Test
  void shouldThrowNotFound_whenOrganizationMissing() {
    UUID id = UUID.randomUUID();
    when(organizationRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> organizationService.getOrganization(id))
        .isInstanceOf(OrganizationNotFoundException.class);
  }

  @Test
  void shouldDeactivateOrganization() {
    // Given
    UUID id = UUID.randomUUID();
    Organization organization =
        Organization.builder().id(id).name("Acme").mandrillWebhookSecret("x").build();
    when(organizationRepository.findById(id)).thenReturn(Optional.of(organization));

    // When
    Organization result = organizationService.deactivateOrganization(id);

    // Then
    assertThat(result.isActive()).isFalse();
    verify(organizationRepository).save(organization);
  }

  @Test
  void shouldRotateSecret_whenOnlySecretGiven() {
    // Given
    UUID id = UUID.randomUUID();
    Organization organization =
        Organization.builder()
            .id(id)
            .name("Acme")
            .webhookEmail("inbound@acme.test")
            .mandrillWebhookSecret("old-secret")
            .build();
    when(organizationRepository.findById(id)).thenReturn(Optional.of(organization));
    when(organizationRepository.save(any(Organization.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    UpdateOrganizationRequest request =
        UpdateOrganizationRequest.builder().mandrillWebhookSecret("new-secret").build();

    // When
    Organization result = organizationService.updateOrganization(id, request);

    // Then
    assertThat(result.getMandrillWebhookSecret()).isEqualTo("new-secret");
    assertThat(result.getName()).isEqualTo("Acme");
    assertThat(result.getWebhookEmail()).isEqualTo("inbound@acme.test");
    assertThat(result.isActive()).isTrue();
    verify(organizationRepository).save(organization);
    verify(counter).increment();
  }

  @Test
  void shouldRenameAndReactivate_whenNameIsFree() {
    // Given
    UUID id = UUID.randomUUID();
    Organization organization =
        Organization.builder().id(id).name("Acme").mandrillWebhookSecret("x").build();
    organization.deactivate();
    when(organizationRepository.findById(id)).thenReturn(Optional.of(organization));
    when(organizationRepository.existsByName("Acme Corp")).thenReturn(false);
    when(organizationRepository.save(any(Organization.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    UpdateOrganizationRequest request =
        UpdateOrganizationRequest.builder().name(" Acme Corp ").active(true).build();

    // When
    Organization result = organizationService.updateOrganization(id, request);

    // Then
    assertThat(result.getName()).isEqualTo("Acme Corp");
    assertThat(result.isActive()).isTrue();
    assertThat(result.getMandrillWebhookSecret()).isEqualTo("x");
  }

  @Test
  void shouldKeepName_whenRenamedToItself() {
    UUID id = UUID.randomUUID();
    Organization organization =
        Organization.builder().id(id).name("Acme").mandrillWebhookSecret("x").build();
    when(organizationRepository.findById(id)).thenReturn(Optional.of(organization));
    when(organizationRepository.existsByName("Acme")).thenReturn(true);
    when(organizationRepository.save(any(Organization.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    Organization result =
        organizationService.updateOrganization(
            id, UpdateOrganizationRequest.builder().name("Acme").build());

    assertThat(result.getName()).isEqualTo("Acme");
  }

  @Test
  void shouldRejectUpdate_whenNewNameTaken() {
    // Given
    UUID id = UUID.randomUUID();
    Organization organization =
        Organization.builder().id(id).name("Acme").mandrillWebhookSecret("x").build();
    when(organizationRepository.findById(id)).thenReturn(Optional.of(organization));
    when(organizationRepository.existsByName("Globex")).thenReturn(true);

    // When / Then
    assertThatThrownBy(
            () ->
                organizationService.updateOrganization(
                    id, UpdateOrganizationRequest.builder().name("Globex").build()))
        .isInstanceOf(DuplicateOrganizationException.class);
    verify(organizationRepository, never()).save(any());
  }

  @Test
  void shouldThrowNotFound_whenUpdatingMissingOrganization() {
    UUID id = UUID.randomUUID();
    when(organizationRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                organizationService.updateOrganization(
                    id, UpdateOrganizationRequest.builder().active(false).build()))
        .isInstanceOf(OrganizationNotFoundException.class);
  }
}
