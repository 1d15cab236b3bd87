package com.flamingo.ai.docsearch.domain.model;

import java.util.List;
import java.util.Map;

/**
 * One ranked hit.
 *
 * @param document stored fields of the record, without page text
 * @param formatted highlighted variant of each highlighted field
 * @param matchedFields fields that contain a highlighted match
 * @param pageNumber first page containing the query, only for paginated formats
 * @param score relevance score
 */
public record SearchResultHit(
    Map<String, Object> document,
    Map<String, String> formatted,
    List<String> matchedFields,
    Integer pageNumber,
    Double score) {}
