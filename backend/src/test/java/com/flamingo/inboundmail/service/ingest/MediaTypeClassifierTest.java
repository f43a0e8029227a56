package com.flamingo.inboundmail.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MediaTypeClassifierTest {

  private final MediaTypeClassifier classifier = new MediaTypeClassifier();

  @Test
  @DisplayName("Should classify .pdf files as PDF whatever the declared type")
  void shouldClassifyPdfExtensionAsPdf() {
    assertThat(classifier.classify("Invoice.PDF", "application/octet-stream"))
        .isEqualTo(MediaTypeClassifier.PDF);
    assertThat(classifier.classify("scan.pdf", "image/png")).isEqualTo(MediaTypeClassifier.PDF);
  }

  @Test
  @DisplayName("Should keep a specific declared type, without parameters")
  void shouldKeepDeclaredType() {
    assertThat(classifier.classify("notes", "Text/Plain; charset=UTF-8")).isEqualTo("text/plain");
  }

  @Test
  @DisplayName("Should detect the type from the filename when the declared type is generic")
  void shouldDetectTypeFromFilename() {
    assertThat(classifier.classify("photo.png", "application/octet-stream"))
        .isEqualTo("image/png");
    assertThat(classifier.classify("notes.txt", null)).isEqualTo("text/plain");
  }

  @Test
  @DisplayName("Should fall back to octet-stream when nothing is known")
  void shouldFallBackToOctetStream() {
    assertThat(classifier.classify(null, null)).isEqualTo("application/octet-stream");
  }

  @Test
  @DisplayName("Should consider only PDFs extractable")
  void shouldConsiderOnlyPdfsExtractable() {
    assertThat(classifier.isExtractable(MediaTypeClassifier.PDF)).isTrue();
    assertThat(classifier.isExtractable("image/png")).isFalse();
    assertThat(classifier.isExtractable(null)).isFalse();
  }
}
