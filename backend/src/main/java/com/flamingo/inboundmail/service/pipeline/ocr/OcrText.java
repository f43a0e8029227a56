package com.flamingo.inboundmail.service.pipeline.ocr;

/** Text extracted from a document. */
public record OcrText(String text, int pageCount) {}
