package com.flamingo.ai.docsearch.domain.model;

import java.util.List;

/**
 * A window of ranked search hits.
 *
 * @param hits shaped hits, best first
 * @param query the query as received
 * @param processingTimeMs engine processing time
 * @param estimatedTotalHits number of matching documents
 * @param limit window size
 * @param offset window start
 */
public record SearchResult(
    List<SearchResultHit> hits,
    String query,
    long processingTimeMs,
    long estimatedTotalHits,
    int limit,
    int offset) {}
