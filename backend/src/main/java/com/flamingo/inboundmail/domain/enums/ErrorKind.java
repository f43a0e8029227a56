package com.flamingo.inboundmail.domain.enums;

/** Classification of a failed extraction attempt. */
public enum ErrorKind {
  /** The OCR call did not finish within the per-job timeout, or the claim lease expired. */
  TIMEOUT,
  /** The attachment bytes could not be read or decoded as a document. */
  DECODE_ERROR,
  /** The OCR engine failed while processing a readable document. */
  ENGINE_ERROR
}
