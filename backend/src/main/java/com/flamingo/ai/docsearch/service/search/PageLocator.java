package com.flamingo.ai.docsearch.service.search;

import com.flamingo.ai.docsearch.domain.model.PageText;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import org.springframework.stereotype.Component;

/**
 * Finds the first page whose text contains the query.
 *
 * <p>Matching is a case-insensitive literal substring test. Matches the engine found through typo
 * tolerance or stemming are not literal substrings and yield no page.
 */
@Component
public class PageLocator {

  public OptionalInt locate(List<PageText> pageInfo, String query) {
    if (pageInfo == null || pageInfo.isEmpty() || query == null || query.isBlank()) {
      return OptionalInt.empty();
    }
    String needle = query.trim().toLowerCase(Locale.ROOT);
    for (PageText page : pageInfo) {
      if (page.text() != null && page.text().toLowerCase(Locale.ROOT).contains(needle)) {
        return OptionalInt.of(page.page());
      }
    }
    return OptionalInt.empty();
  }
}
