package com.flamingo.ai.docsearch.elasticsearch;

/**
 * Keyword query against the document index.
 *
 * @param query user query text
 * @param limit maximum number of hits
 * @param offset number of hits to skip
 * @param filters boolean filter expression in query-string syntax, or {@code null}
 */
public record SearchQuery(String query, int limit, int offset, String filters) {

  public boolean hasFilters() {
    return filters != null && !filters.isBlank();
  }
}
