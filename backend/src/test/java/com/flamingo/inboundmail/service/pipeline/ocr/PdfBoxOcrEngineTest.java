package com.flamingo.inboundmail.service.pipeline.ocr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.exception.JobFailureException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PdfBoxOcrEngineTest {

  private final PdfBoxOcrEngine engine = new PdfBoxOcrEngine();

  @Test
  @DisplayName("Should extract text page by page separated by form feeds")
  void shouldExtractTextPerPage() throws IOException {
    byte[] pdf = pdf("Invoice 2024-001", "Total due 42 EUR");

    OcrText result = engine.extract(pdf);

    assertThat(result.pageCount()).isEqualTo(2);
    assertThat(result.text()).isEqualTo("Invoice 2024-001\fTotal due 42 EUR");
  }

  @Test
  @DisplayName("Should return empty text for a PDF without text")
  void shouldReturnEmptyTextForBlankPdf() throws IOException {
    byte[] pdf = pdf("");

    OcrText result = engine.extract(pdf);

    assertThat(result.pageCount()).isEqualTo(1);
    assertThat(result.text()).isEmpty();
  }

  @Test
  @DisplayName("Should keep an empty slot for a page without a text layer")
  void shouldKeepEmptySlotForPageWithoutText() throws IOException {
    byte[] pdf = pdf("Cover letter", "", "Signature page");

    OcrText result = engine.extract(pdf);

    assertThat(result.pageCount()).isEqualTo(3);
    assertThat(result.text()).isEqualTo("Cover letter\f\fSignature page");
  }

  @Test
  @DisplayName("Should report bytes that are not a PDF as a decode error")
  void shouldReportDecodeErrorForGarbage() {
    byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> engine.extract(garbage))
        .isInstanceOfSatisfying(
            JobFailureException.class,
            e -> assertThat(e.getErrorKind()).isEqualTo(ErrorKind.DECODE_ERROR));
  }

  @Test
  @DisplayName("Should report an empty document as a decode error")
  void shouldReportDecodeErrorForEmptyInput() {
    assertThatThrownBy(() -> engine.extract(new byte[0]))
        .isInstanceOfSatisfying(
            JobFailureException.class,
            e -> assertThat(e.getErrorKind()).isEqualTo(ErrorKind.DECODE_ERROR));
  }

  private static byte[] pdf(String... pages) throws IOException {
    try (PDDocument document = new PDDocument()) {
      for (String text : pages) {
        PDPage page = new PDPage();
        document.addPage(page);
        if (text.isEmpty()) {
          continue;
        }
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.beginText();
          content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
          content.newLineAtOffset(72, 700);
          content.showText(text);
          content.endText();
        }
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      return out.toByteArray();
    }
  }
}
