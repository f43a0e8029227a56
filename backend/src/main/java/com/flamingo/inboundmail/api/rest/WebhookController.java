package com.flamingo.inboundmail.api.rest;

import com.flamingo.inboundmail.api.dto.response.WebhookAckResponse;
import com.flamingo.inboundmail.config.IngestConfig;
import com.flamingo.inboundmail.service.ingest.IngestionResult;
import com.flamingo.inboundmail.service.ingest.WebhookIngestionService;
import com.flamingo.inboundmail.service.ingest.provider.ProviderAdapterRegistry;
import com.flamingo.inboundmail.service.ingest.provider.WebhookRequest;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/** Receives inbound mail webhooks, one endpoint per provider. */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

  private final WebhookIngestionService ingestionService;
  private final ProviderAdapterRegistry providerRegistry;
  private final IngestConfig ingestConfig;

  /**
   * Accepts a webhook delivery. Responds 202 once every event is either stored or recognized as a
   * duplicate; extraction happens later.
   */
  @PostMapping("/{provider}")
  public ResponseEntity<WebhookAckResponse> receive(
      @PathVariable String provider,
      @RequestBody(required = false) byte[] body,
      HttpServletRequest request) {
    WebhookRequest webhookRequest =
        new WebhookRequest(
            resolveWebhookUrl(request), headersOf(request), request.getContentType(), body);

    IngestionResult result = ingestionService.ingest(provider, webhookRequest);

    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(WebhookAckResponse.builder().status(result.status()).build());
  }

  /** Providers probe the URL with HEAD before they start delivering. */
  @RequestMapping(value = "/{provider}", method = RequestMethod.HEAD)
  public ResponseEntity<Void> probe(@PathVariable String provider) {
    providerRegistry.route(provider);
    return ResponseEntity.ok().build();
  }

  private String resolveWebhookUrl(HttpServletRequest request) {
    String path = request.getRequestURI();
    String publicBaseUrl = ingestConfig.getWebhook().getPublicBaseUrl();
    if (StringUtils.hasText(publicBaseUrl)) {
      return stripTrailingSlash(publicBaseUrl.trim()) + path;
    }
    String scheme = firstValue(request.getHeader("X-Forwarded-Proto"));
    String host = firstValue(request.getHeader("X-Forwarded-Host"));
    if (scheme == null) {
      scheme = request.getScheme();
    }
    if (host == null) {
      host = request.getHeader(HttpHeaders.HOST);
    }
    if (host == null) {
      return request.getRequestURL().toString();
    }
    return scheme + "://" + host + path;
  }

  private static Map<String, String> headersOf(HttpServletRequest request) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (String name : Collections.list(request.getHeaderNames())) {
      headers.put(name, request.getHeader(name));
    }
    return headers;
  }

  // Proxies may append to forwarding headers; the first value is the client-facing one.
  private static String firstValue(String header) {
    if (!StringUtils.hasText(header)) {
      return null;
    }
    int comma = header.indexOf(',');
    return (comma < 0 ? header : header.substring(0, comma)).trim();
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
