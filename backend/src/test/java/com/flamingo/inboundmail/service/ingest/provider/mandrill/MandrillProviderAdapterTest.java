package com.flamingo.inboundmail.service.ingest.provider.mandrill;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.inboundmail.domain.entity.Organization;
import com.flamingo.inboundmail.exception.MalformedPayloadException;
import com.flamingo.inboundmail.exception.WebhookAuthenticationException;
import com.flamingo.inboundmail.service.ingest.model.NormalizedEvent;
import com.flamingo.inboundmail.service.ingest.provider.ParsedWebhook;
import com.flamingo.inboundmail.service.ingest.provider.WebhookRequest;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
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
class MandrillProviderAdapterTest {

  private static final String URL = "https://mail.example.com/api/webhooks/mandrill";

  @Mock private MandrillSignatureVerifier signatureVerifier;

  private MandrillProviderAdapter adapter;
  private UUID organizationId;

  @BeforeEach
  void setUp() {
    adapter =
        new MandrillProviderAdapter(
            signatureVerifier, new MandrillEventMapper(Clock.systemUTC()), new ObjectMapper());
    organizationId = UUID.randomUUID();
    when(signatureVerifier.identifyOrganization(any()))
        .thenReturn(Organization.builder().id(organizationId).name("acme").build());
  }

  @Test
  void shouldParseFormEncodedEvents_whenSignatureValid() {
    // Given
    String events =
        "[{\"event\":\"inbound\",\"msg\":{\"_id\":\"m-1\",\"subject\":\"one\"}},"
            + "{\"event\":\"inbound\",\"msg\":{\"_id\":\"m-2\",\"subject\":\"two\"}}]";
    WebhookRequest request = formRequest("mandrill_events", events);

    // When
    ParsedWebhook parsed = adapter.parse(request);

    // Then
    assertThat(parsed.acknowledgementOnly()).isFalse();
    assertThat(parsed.events())
        .extracting(NormalizedEvent::externalEventId)
        .containsExactly("m-1", "m-2");
    assertThat(parsed.events()).allMatch(event -> organizationId.equals(event.organizationId()));
  }

  @Test
  void shouldReadEventsFromAlternativeFormField() {
    WebhookRequest request = formRequest("events", "[{\"msg\":{\"_id\":\"m-9\"}}]");

    ParsedWebhook parsed = adapter.parse(request);

    assertThat(parsed.events()).hasSize(1);
  }

  @Test
  void shouldAcceptSingleEventAsJsonBody() {
    WebhookRequest request = jsonRequest("{\"event\":\"inbound\",\"msg\":{\"_id\":\"m-3\"}}");

    ParsedWebhook parsed = adapter.parse(request);

    assertThat(parsed.events())
        .extracting(NormalizedEvent::externalEventId)
        .containsExactly("m-3");
  }

  @Test
  @DisplayName("Should acknowledge the validation ping without events")
  void shouldAcknowledgePing() {
    ParsedWebhook ping = adapter.parse(jsonRequest("{\"type\":\"ping\"}"));
    ParsedWebhook emptyBatch = adapter.parse(formRequest("mandrill_events", "[]"));

    assertThat(ping.acknowledgementOnly()).isTrue();
    assertThat(emptyBatch.acknowledgementOnly()).isTrue();
  }

  @Test
  @DisplayName("Should verify the signature before looking at the payload")
  void shouldVerifySignatureBeforeParsing() {
    when(signatureVerifier.identifyOrganization(any()))
        .thenThrow(new WebhookAuthenticationException("mandrill", "Missing header"));
    WebhookRequest request = jsonRequest("not json at all");

    assertThatThrownBy(() -> adapter.parse(request))
        .isInstanceOf(WebhookAuthenticationException.class);
  }

  @Test
  void shouldRejectInvalidJson() {
    WebhookRequest request = formRequest("mandrill_events", "[{broken");

    assertThatThrownBy(() -> adapter.parse(request))
        .isInstanceOf(MalformedPayloadException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  void shouldRejectFormWithoutEventsField() {
    WebhookRequest request = formRequest("something_else", "[]");

    assertThatThrownBy(() -> adapter.parse(request))
        .isInstanceOf(MalformedPayloadException.class);
  }

  @Test
  void shouldRejectEventsThatAreNotObjects() {
    WebhookRequest request = jsonRequest("[\"inbound\", 42]");

    assertThatThrownBy(() -> adapter.parse(request))
        .isInstanceOf(MalformedPayloadException.class);
  }

  @Test
  void shouldRejectEmptyBody() {
    WebhookRequest request = jsonRequest("");

    assertThatThrownBy(() -> adapter.parsePayload(request))
        .isInstanceOf(MalformedPayloadException.class);
    verify(signatureVerifier, never()).identifyOrganization(any());
  }

  private static WebhookRequest formRequest(String field, String value) {
    byte[] body =
        (field + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8))
            .getBytes(StandardCharsets.UTF_8);
    return new WebhookRequest(
        URL, Map.of("X-Mandrill-Signature", "sig"), "application/x-www-form-urlencoded", body);
  }

  private static WebhookRequest jsonRequest(String json) {
    return new WebhookRequest(
        URL,
        Map.of("X-Mandrill-Signature", "sig"),
        "application/json",
        json.getBytes(StandardCharsets.UTF_8));
  }
}
