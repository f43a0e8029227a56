package com.flamingo.inboundmail.service.ingest.model;

/**
 * A decoded attachment as delivered by the provider.
 *
 * @param filename decoded filename, never blank
 * @param declaredMediaType media type claimed by the provider, may be blank
 * @param content raw attachment bytes
 */
public record AttachmentRef(String filename, String declaredMediaType, byte[] content) {

  public long sizeBytes() {
    return content == null ? 0 : content.length;
  }
}
