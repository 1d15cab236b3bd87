package com.flamingo.ai.docsearch.extraction.extractor;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PlainTextExtractor Tests")
class PlainTextExtractorTest {

  private final PlainTextExtractor extractor = new PlainTextExtractor();

  @Test
  void shouldDecodeUtf8() {
    byte[] bytes = "Prüfbericht Nr. 5".getBytes(StandardCharsets.UTF_8);

    assertThat(extractor.decode("report.txt", bytes)).isEqualTo("Prüfbericht Nr. 5");
  }

  @Test
  void shouldStripUtf8ByteOrderMark() {
    byte[] body = "hello".getBytes(StandardCharsets.UTF_8);
    byte[] bytes = new byte[body.length + 3];
    bytes[0] = (byte) 0xEF;
    bytes[1] = (byte) 0xBB;
    bytes[2] = (byte) 0xBF;
    System.arraycopy(body, 0, bytes, 3, body.length);

    assertThat(extractor.decode("bom.txt", bytes)).isEqualTo("hello");
  }

  @Test
  void shouldDecodeUtf16WithByteOrderMark() {
    byte[] bytes = "certificate".getBytes(StandardCharsets.UTF_16);

    assertThat(extractor.decode("utf16.txt", bytes)).isEqualTo("certificate");
  }

  @Test
  void shouldFallBackToWindows1252ForInvalidUtf8() {
    byte[] bytes = "café".getBytes(Charset.forName("windows-1252"));

    assertThat(extractor.decode("legacy.txt", bytes)).isEqualTo("café");
  }

  @Test
  void shouldReturnNoPages() {
    assertThat(extractor.extract("a.txt", "x".getBytes(StandardCharsets.UTF_8)).pages()).isEmpty();
  }
}
