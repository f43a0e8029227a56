package com.flamingo.inboundmail.service.ingest;

import java.util.Locale;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;

/**
 * Decides the media type of an attachment.
 *
 * <p>Providers frequently send {@code application/octet-stream} or nothing at all; in that case the
 * type is detected from the filename with Apache Tika. A {@code .pdf} extension always wins, since
 * PDFs are what the extraction pipeline consumes.
 */
@Component
public class MediaTypeClassifier {

  public static final String PDF = "application/pdf";
  static final String OCTET_STREAM = "application/octet-stream";

  private final Tika tika = new Tika();

  public String classify(String filename, String declaredMediaType) {
    String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
    if (name.endsWith(".pdf")) {
      return PDF;
    }
    String declared = normalize(declaredMediaType);
    if (!declared.isEmpty() && !OCTET_STREAM.equals(declared)) {
      return declared;
    }
    String detected = name.isEmpty() ? OCTET_STREAM : tika.detect(name);
    return detected == null ? OCTET_STREAM : detected;
  }

  public boolean isExtractable(String mediaType) {
    return PDF.equals(mediaType);
  }

  private static String normalize(String mediaType) {
    if (mediaType == null) {
      return "";
    }
    int params = mediaType.indexOf(';');
    String bare = params >= 0 ? mediaType.substring(0, params) : mediaType;
    return bare.trim().toLowerCase(Locale.ROOT);
  }
}
