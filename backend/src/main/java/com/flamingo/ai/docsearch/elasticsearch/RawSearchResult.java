package com.flamingo.ai.docsearch.elasticsearch;

import java.util.List;

/**
 * Unshaped search response.
 *
 * @param hits ranked hits of the requested window
 * @param totalHits number of matching documents
 * @param tookMs engine processing time
 */
public record RawSearchResult(List<RawHit> hits, long totalHits, long tookMs) {}
