package com.flamingo.inboundmail.service.ingest.provider.mandrill;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.flamingo.inboundmail.domain.entity.Organization;
import com.flamingo.inboundmail.domain.repository.OrganizationRepository;
import com.flamingo.inboundmail.exception.WebhookAuthenticationException;
import com.flamingo.inboundmail.service.ingest.provider.WebhookRequest;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MandrillSignatureVerifierTest {

  private static final String URL = "https://mail.example.com/api/webhooks/mandrill";
  private static final String FORM = "application/x-www-form-urlencoded";

  @Mock private OrganizationRepository organizationRepository;

  private MandrillSignatureVerifier verifier;
  private Organization acme;
  private Organization globex;

  @BeforeEach
  void setUp() {
    verifier = new MandrillSignatureVerifier(organizationRepository);
    acme = organization("acme", "acme-secret");
    globex = organization("globex", "globex-secret");
    when(organizationRepository.findByActiveTrue()).thenReturn(List.of(acme, globex));
  }

  @Test
  void shouldIdentifyOrganization_whenFormBodySignedWithItsSecret() {
    // Given
    String events = "[{\"event\":\"inbound\"}]";
    byte[] body = formBody(events);
    String signature =
        MandrillSignatureVerifier.sign("globex-secret", URL + "mandrill_events" + events);
    WebhookRequest request = request(Map.of("X-Mandrill-Signature", signature), FORM, body);

    // When
    Organization result = verifier.identifyOrganization(request);

    // Then
    assertThat(result).isSameAs(globex);
  }

  @Test
  void shouldSignUrlFollowedByRawBody_whenBodyIsJson() {
    // Given
    String json = "[{\"event\":\"inbound\"}]";
    WebhookRequest request =
        request(Map.of(), "application/json", json.getBytes(StandardCharsets.UTF_8));

    // When / Then
    assertThat(MandrillSignatureVerifier.signedData(request)).isEqualTo(URL + json);
  }

  @Test
  void shouldSignFormParametersInKeyOrder() {
    // Given
    byte[] body = "zeta=2&alpha=1&mandrill_events=%5B%5D".getBytes(StandardCharsets.UTF_8);
    WebhookRequest request = request(Map.of(), FORM, body);

    // When / Then
    assertThat(MandrillSignatureVerifier.signedData(request))
        .isEqualTo(URL + "alpha1mandrill_events[]zeta2");
  }

  @Test
  void shouldAcceptLegacyMailchimpHeader() {
    // Given
    String json = "[]";
    String signature = MandrillSignatureVerifier.sign("acme-secret", URL + json);
    WebhookRequest request =
        request(
            Map.of("X-Mailchimp-Signature", signature),
            "application/json",
            json.getBytes(StandardCharsets.UTF_8));

    // When / Then
    assertThat(verifier.identifyOrganization(request)).isSameAs(acme);
  }

  @Test
  @DisplayName("Should reject a request without a signature header")
  void shouldRejectMissingSignature() {
    WebhookRequest request = request(Map.of(), FORM, formBody("[]"));

    assertThatThrownBy(() -> verifier.identifyOrganization(request))
        .isInstanceOf(WebhookAuthenticationException.class)
        .hasMessageContaining("Missing");
  }

  @Test
  @DisplayName("Should reject a signature made with an unknown secret")
  void shouldRejectUnknownSecret() {
    byte[] body = formBody("[]");
    String signature = MandrillSignatureVerifier.sign("wrong", URL + "mandrill_events[]");
    WebhookRequest request = request(Map.of("X-Mandrill-Signature", signature), FORM, body);

    assertThatThrownBy(() -> verifier.identifyOrganization(request))
        .isInstanceOf(WebhookAuthenticationException.class)
        .hasMessageContaining("does not match");
  }

  @Test
  @DisplayName("Should reject a signature computed for a different URL")
  void shouldRejectSignatureForDifferentUrl() {
    byte[] body = formBody("[]");
    String signature =
        MandrillSignatureVerifier.sign(
            "acme-secret", "http://other.example.com/hook" + "mandrill_events[]");
    WebhookRequest request = request(Map.of("X-Mandrill-Signature", signature), FORM, body);

    assertThatThrownBy(() -> verifier.identifyOrganization(request))
        .isInstanceOf(WebhookAuthenticationException.class);
  }

  private static byte[] formBody(String events) {
    return ("mandrill_events=" + URLEncoder.encode(events, StandardCharsets.UTF_8))
        .getBytes(StandardCharsets.UTF_8);
  }

  private static WebhookRequest request(
      Map<String, String> headers, String contentType, byte[] body) {
    return new WebhookRequest(URL, headers, contentType, body);
  }

  private static Organization organization(String name, String secret) {
    return Organization.builder()
        .id(UUID.randomUUID())
        .name(name)
        .mandrillWebhookSecret(secret)
        .build();
  }
}
