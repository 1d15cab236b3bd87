package com.flamingo.ai.docsearch.extraction;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Normalizes extracted text before indexing.
 *
 * <p>Removes control characters other than tab and line feed, trims every line, drops blank
 * lines, collapses runs of horizontal whitespace and truncates to the configured maximum length.
 */
@Component
public class TextCleaner {

  private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\t\\n\\r]]");
  private static final Pattern HORIZONTAL_WS = Pattern.compile("[\\t \\u00A0\\x0B]+");
  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?|\\n");

  private final int maxTextLength;

  @Autowired
  public TextCleaner(DocSearchConfig config) {
    this(config.getExtraction().getMaxTextLength());
  }

  TextCleaner(int maxTextLength) {
    if (maxTextLength < 0) {
      throw new IllegalArgumentException(
          "docsearch.extraction.max-text-length must not be negative: " + maxTextLength);
    }
    this.maxTextLength = maxTextLength;
  }

  public String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String withoutControls = CONTROL_CHARS.matcher(text).replaceAll("");
    String cleaned =
        LINE_BREAK
            .splitAsStream(withoutControls)
            .map(line -> HORIZONTAL_WS.matcher(line).replaceAll(" ").strip())
            .filter(line -> !line.isEmpty())
            .collect(Collectors.joining("\n"));
    return truncate(cleaned);
  }

  private String truncate(String text) {
    if (text.length() <= maxTextLength) {
      return text;
    }
    // keep surrogate pairs intact
    int end = maxTextLength;
    if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end);
  }
}
