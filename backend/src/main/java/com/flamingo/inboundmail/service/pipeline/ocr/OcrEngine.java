package com.flamingo.inboundmail.service.pipeline.ocr;

/** Extracts text from document bytes. */
public interface OcrEngine {

  /**
   * Extracts the text of the document.
   *
   * @throws com.flamingo.inboundmail.exception.JobFailureException with {@code DECODE_ERROR} when
   *     the bytes are not a readable document, {@code ENGINE_ERROR} when extraction itself fails
   */
  OcrText extract(byte[] document);
}
