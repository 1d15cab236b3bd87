package com.flamingo.ai.docsearch.extraction.extractor;

import com.flamingo.ai.docsearch.extraction.DocumentFormat;
import com.flamingo.ai.docsearch.extraction.ExtractedText;
import com.flamingo.ai.docsearch.extraction.TextExtractor;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for plain text files.
 *
 * <p>Decoding order: byte-order mark if present (UTF-8 or UTF-16), strict UTF-8, then
 * windows-1252, which accepts any byte sequence.
 */
@Component
@Slf4j
public class PlainTextExtractor implements TextExtractor {

  private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

  @Override
  public Set<String> extensions() {
    return Set.of("txt");
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.TEXT;
  }

  @Override
  public ExtractedText extract(String fileName, byte[] content) {
    return ExtractedText.of(decode(fileName, content));
  }

  String decode(String fileName, byte[] content) {
    if (hasPrefix(content, 0xEF, 0xBB, 0xBF)) {
      return new String(content, 3, content.length - 3, StandardCharsets.UTF_8);
    }
    if (hasPrefix(content, 0xFE, 0xFF) || hasPrefix(content, 0xFF, 0xFE)) {
      // the UTF_16 decoder consumes the byte-order mark
      return new String(content, StandardCharsets.UTF_16);
    }
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(content))
          .toString();
    } catch (CharacterCodingException e) {
      log.debug("'{}' is not valid UTF-8, decoding as windows-1252", fileName);
      return new String(content, WINDOWS_1252);
    }
  }

  private static boolean hasPrefix(byte[] content, int... prefix) {
    if (content.length < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if ((content[i] & 0xFF) != prefix[i]) {
        return false;
      }
    }
    return true;
  }
}
