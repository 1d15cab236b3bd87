package com.flamingo.ai.docsearch.extraction;

import com.flamingo.ai.docsearch.domain.model.PageText;
import java.util.List;

/**
 * Raw extractor output before cleaning.
 *
 * @param text full document text
 * @param pages per-page text for paginated formats, empty otherwise
 */
public record ExtractedText(String text, List<PageText> pages) {

  public ExtractedText {
    text = text == null ? "" : text;
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  public static ExtractedText of(String text) {
    return new ExtractedText(text, List.of());
  }
}
