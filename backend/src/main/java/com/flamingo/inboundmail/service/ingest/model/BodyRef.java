package com.flamingo.inboundmail.service.ingest.model;

/** One body part of an inbound message. */
public record BodyRef(String mediaType, String content) {

  public static final String TEXT_PLAIN = "text/plain";
  public static final String TEXT_HTML = "text/html";

  public boolean isPlainText() {
    return TEXT_PLAIN.equals(mediaType);
  }

  public boolean isHtml() {
    return TEXT_HTML.equals(mediaType);
  }
}
