package com.flamingo.inboundmail.service.pipeline.ocr;

import com.flamingo.inboundmail.domain.enums.ErrorKind;
import com.flamingo.inboundmail.exception.JobFailureException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * {@link OcrEngine} built on Apache PDFBox 3.x text extraction.
 *
 * <p>Pages are stripped one at a time and separated by a form feed, so page boundaries survive in
 * the stored text.
 *
 * <p>This engine reads the embedded text layer only; it does not rasterize pages or run character
 * recognition. A scanned page without a text layer yields empty text for that page and the job
 * still succeeds. Image-only documents need a recognizing {@link OcrEngine} bean in its place.
 */
@Service
@Slf4j
public class PdfBoxOcrEngine implements OcrEngine {

  private static final char PAGE_SEPARATOR = '\f';

  @Override
  public OcrText extract(byte[] document) {
    if (document == null || document.length == 0) {
      throw new JobFailureException(ErrorKind.DECODE_ERROR, "Empty document");
    }

    try (PDDocument pdf = load(document)) {
      int pages = pdf.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();
      StringBuilder text = new StringBuilder();
      int emptyPages = 0;
      for (int page = 1; page <= pages; page++) {
        if (Thread.currentThread().isInterrupted()) {
          throw new JobFailureException(
              ErrorKind.TIMEOUT, "Extraction interrupted at page " + page);
        }
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        if (page > 1) {
          text.append(PAGE_SEPARATOR);
        }
        String pageText = stripper.getText(pdf).strip();
        if (pageText.isEmpty()) {
          emptyPages++;
        }
        text.append(pageText);
      }
      if (emptyPages > 0) {
        log.info("{} of {} pages have no text layer, probably scanned", emptyPages, pages);
      }
      log.debug("Extracted {} characters from {} pages", text.length(), pages);
      return new OcrText(text.toString(), pages);
    } catch (JobFailureException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new JobFailureException(
          ErrorKind.ENGINE_ERROR, "Text extraction failed: " + e.getMessage(), e);
    }
  }

  private PDDocument load(byte[] document) {
    try {
      return Loader.loadPDF(document);
    } catch (InvalidPasswordException e) {
      throw new JobFailureException(ErrorKind.DECODE_ERROR, "PDF is password protected", e);
    } catch (IOException e) {
      throw new JobFailureException(
          ErrorKind.DECODE_ERROR, "Not a readable PDF: " + e.getMessage(), e);
    }
  }
}
