package com.flamingo.inboundmail.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for webhook ingestion and attachment storage. */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Getter
@Setter
public class IngestConfig {

  private Webhook webhook = new Webhook();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Webhook {
    /**
     * Externally visible base URL, e.g. {@code https://mail.example.com}. Providers sign the URL
     * they posted to, so behind a proxy this must match what was registered with the provider.
     * When blank the URL is rebuilt from the request and forwarding headers.
     */
    private String publicBaseUrl = "";
  }

  @Getter
  @Setter
  public static class Storage {
    private String baseDir = "./data/attachments";
  }
}
