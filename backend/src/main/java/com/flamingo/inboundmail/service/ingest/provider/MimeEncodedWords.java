package com.flamingo.inboundmail.service.ingest.provider;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Decodes RFC 2047 encoded words, as found in attachment filenames and subjects. */
public final class MimeEncodedWords {

  private static final Pattern ENCODED_WORD =
      Pattern.compile("=\\?([^?]+)\\?([bBqQ])\\?([^?]*)\\?=");
  private static final Pattern WHITESPACE_BETWEEN_WORDS = Pattern.compile("\\?=\\s+=\\?");

  private MimeEncodedWords() {}

  /**
   * Decodes every encoded word in the value. Words that cannot be decoded are left as they are.
   */
  public static String decode(String value) {
    if (value == null || !value.contains("=?")) {
      return value;
    }
    // whitespace between adjacent encoded words is not part of the text
    String joined = WHITESPACE_BETWEEN_WORDS.matcher(value).replaceAll("?==?");
    Matcher matcher = ENCODED_WORD.matcher(joined);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String decoded = decodeWord(matcher.group(1), matcher.group(2), matcher.group(3));
      matcher.appendReplacement(
          out, Matcher.quoteReplacement(decoded != null ? decoded : matcher.group()));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private static String decodeWord(String charsetName, String encoding, String text) {
    Charset charset = resolveCharset(charsetName);
    try {
      byte[] bytes =
          "B".equalsIgnoreCase(encoding) ? Base64.getDecoder().decode(text) : decodeQ(text);
      return new String(bytes, charset);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static byte[] decodeQ(String text) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '_') {
        out.write(' ');
      } else if (c == '=' && i + 2 < text.length()) {
        out.write(Integer.parseInt(text.substring(i + 1, i + 3), 16));
        i += 2;
      } else if (c == '=') {
        throw new IllegalArgumentException("Truncated escape in encoded word");
      } else {
        out.write(c);
      }
    }
    return out.toByteArray();
  }

  private static Charset resolveCharset(String name) {
    // RFC 2231 language suffix, e.g. utf-8*en
    String bare = name.contains("*") ? name.substring(0, name.indexOf('*')) : name;
    try {
      return Charset.forName(bare);
    } catch (IllegalArgumentException e) {
      return StandardCharsets.UTF_8;
    }
  }
}
