package com.flamingo.inboundmail.service.ingest.provider.mandrill;

import com.flamingo.inboundmail.domain.entity.Organization;
import com.flamingo.inboundmail.domain.repository.OrganizationRepository;
import com.flamingo.inboundmail.exception.WebhookAuthenticationException;
import com.flamingo.inboundmail.service.ingest.provider.WebhookRequest;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Verifies Mandrill webhook signatures.
 *
 * <p>Mandrill signs the webhook URL followed by every POST parameter, key then value, with keys in
 * sorted order, using HMAC-SHA1 keyed by the webhook key, and sends the Base64 digest in {@code
 * X-Mandrill-Signature}. JSON bodies are signed as URL followed by the raw body.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MandrillSignatureVerifier {

  static final String SIGNATURE_HEADER = "X-Mandrill-Signature";
  static final String LEGACY_SIGNATURE_HEADER = "X-Mailchimp-Signature";
  private static final String HMAC_ALGORITHM = "HmacSHA1";

  private final OrganizationRepository organizationRepository;

  /**
   * Finds the active organization whose secret produced the request signature.
   *
   * @throws WebhookAuthenticationException if the header is missing or no secret matches
   */
  public Organization identifyOrganization(WebhookRequest request) {
    String signature = request.header(SIGNATURE_HEADER);
    if (signature == null || signature.isBlank()) {
      signature = request.header(LEGACY_SIGNATURE_HEADER);
    }
    if (signature == null || signature.isBlank()) {
      throw new WebhookAuthenticationException(
          MandrillProviderAdapter.PROVIDER_ID, "Missing " + SIGNATURE_HEADER + " header");
    }

    String signedData = signedData(request);
    byte[] expected = signature.trim().getBytes(StandardCharsets.US_ASCII);
    List<Organization> candidates = organizationRepository.findByActiveTrue();

    for (Organization organization : candidates) {
      String computed = sign(organization.getMandrillWebhookSecret(), signedData);
      if (MessageDigest.isEqual(expected, computed.getBytes(StandardCharsets.US_ASCII))) {
        log.debug("Mandrill signature verified for organization {}", organization.getName());
        return organization;
      }
    }

    log.warn(
        "Mandrill signature matched none of {} active organizations for {}",
        candidates.size(),
        request.url());
    throw new WebhookAuthenticationException(
        MandrillProviderAdapter.PROVIDER_ID, "Webhook signature does not match");
  }

  /** Builds the string Mandrill signs for this request. */
  static String signedData(WebhookRequest request) {
    StringBuilder data = new StringBuilder(request.url());
    if (request.isFormEncoded()) {
      Map<String, String> sorted = new TreeMap<>(request.formParameters());
      sorted.forEach((key, value) -> data.append(key).append(value));
    } else {
      data.append(request.bodyAsString());
    }
    return data.toString();
  }

  /** Computes the Base64 HMAC-SHA1 signature of the data under the secret. */
  static String sign(String secret, String data) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      return Base64.getEncoder().encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC-SHA1 is not available", e);
    }
  }
}
