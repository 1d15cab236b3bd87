package com.flamingo.ai.docsearch.elasticsearch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query-side configuration of the document index.
 *
 * @param searchableFields searched fields with their boost, in priority order
 * @param filterableFields fields usable in filter expressions
 * @param sortableFields fields usable for sorting
 * @param highlightFields fields returned with {@code <em>} highlights
 * @param rankingRules ranking criteria, most important first
 */
public record IndexSchema(
    Map<String, Float> searchableFields,
    List<String> filterableFields,
    List<String> sortableFields,
    List<String> highlightFields,
    List<RankingRule> rankingRules) {

  public IndexSchema {
    searchableFields = Collections.unmodifiableMap(new LinkedHashMap<>(searchableFields));
    filterableFields = List.copyOf(filterableFields);
    sortableFields = List.copyOf(sortableFields);
    highlightFields = List.copyOf(highlightFields);
    rankingRules = List.copyOf(rankingRules);
  }

  public static IndexSchema defaults() {
    Map<String, Float> searchable = new LinkedHashMap<>();
    searchable.put("name", 3.0f);
    searchable.put("title", 3.0f);
    searchable.put("formNo", 4.0f);
    searchable.put("content", 1.0f);
    searchable.put("path", 1.0f);
    searchable.put("sourceTable", 1.0f);
    return new IndexSchema(
        searchable,
        List.of("sourceTable", "format", "mimeType", "modifiedTime", "metadata"),
        List.of("modifiedTime", "name", "sourceTable"),
        List.of("name", "title", "formNo", "content"),
        List.of(
            RankingRule.EXACTNESS,
            RankingRule.PROXIMITY,
            RankingRule.RELEVANCE,
            RankingRule.RECENCY));
  }

  /** Searchable fields in {@code field^boost} notation. */
  public List<String> boostedFields() {
    return searchableFields.entrySet().stream()
        .map(e -> e.getKey() + "^" + e.getValue())
        .toList();
  }
}
