package com.flamingo.inboundmail.service.ingest.provider;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Raw webhook request as received on the wire.
 *
 * @param url externally visible URL the provider posted to, without query string
 * @param headers request headers keyed by lower-case name
 * @param contentType value of the Content-Type header, may be null
 * @param body raw request body
 */
public record WebhookRequest(
    String url, Map<String, String> headers, String contentType, byte[] body) {

  public WebhookRequest {
    Map<String, String> normalized = new LinkedHashMap<>();
    if (headers != null) {
      headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
    }
    headers = Map.copyOf(normalized);
    body = body == null ? new byte[0] : body;
  }

  /** Returns the header value, matching the name case-insensitively. */
  public String header(String name) {
    return headers.get(name.toLowerCase(Locale.ROOT));
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public boolean isFormEncoded() {
    return contentType != null
        && contentType.toLowerCase(Locale.ROOT).startsWith("application/x-www-form-urlencoded");
  }

  /**
   * Decodes an {@code application/x-www-form-urlencoded} body. Later occurrences of a repeated key
   * win.
   */
  public Map<String, String> formParameters() {
    Map<String, String> params = new LinkedHashMap<>();
    String raw = bodyAsString();
    if (raw.isBlank()) {
      return params;
    }
    for (String pair : raw.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      String value = eq < 0 ? "" : pair.substring(eq + 1);
      params.put(
          URLDecoder.decode(key, StandardCharsets.UTF_8),
          URLDecoder.decode(value, StandardCharsets.UTF_8));
    }
    return params;
  }
}
