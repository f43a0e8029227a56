package com.flamingo.inboundmail.service.ingest.provider;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MimeEncodedWordsTest {

  @Test
  @DisplayName("Should return plain values unchanged")
  void shouldReturnPlainValuesUnchanged() {
    assertThat(MimeEncodedWords.decode("invoice.pdf")).isEqualTo("invoice.pdf");
    assertThat(MimeEncodedWords.decode(null)).isNull();
  }

  @Test
  @DisplayName("Should decode base64 encoded words")
  void shouldDecodeBase64EncodedWords() {
    // "Rechnung März.pdf"
    String encoded = "=?UTF-8?B?UmVjaG51bmcgTcOkcnoucGRm?=";

    assertThat(MimeEncodedWords.decode(encoded)).isEqualTo("Rechnung März.pdf");
  }

  @Test
  @DisplayName("Should decode quoted-printable encoded words with underscores as spaces")
  void shouldDecodeQuotedPrintableEncodedWords() {
    String encoded = "=?ISO-8859-1?Q?Caf=E9_menu.pdf?=";

    assertThat(MimeEncodedWords.decode(encoded)).isEqualTo("Café menu.pdf");
  }

  @Test
  @DisplayName("Should join adjacent encoded words without the whitespace between them")
  void shouldJoinAdjacentEncodedWords() {
    String encoded = "=?UTF-8?Q?Quarterly?= =?UTF-8?Q?_report?=";

    assertThat(MimeEncodedWords.decode(encoded)).isEqualTo("Quarterly report");
  }

  @Test
  @DisplayName("Should keep text around encoded words")
  void shouldKeepSurroundingText() {
    assertThat(MimeEncodedWords.decode("Re: =?UTF-8?B?SGVsbG8=?= there"))
        .isEqualTo("Re: Hello there");
  }

  @Test
  @DisplayName("Should leave undecodable words as they are")
  void shouldLeaveUndecodableWordsAsTheyAre() {
    String broken = "=?UTF-8?B?!!!not-base64!!!?=";

    assertThat(MimeEncodedWords.decode(broken)).isEqualTo(broken);
  }
}
