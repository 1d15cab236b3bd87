package com.flamingo.ai.docsearch.domain.model;

import java.util.Map;

/**
 * Statistics reported by the search index.
 *
 * @param count number of indexed records
 * @param indexing whether a write to the index is in flight
 * @param fieldDistribution number of records holding each field
 */
public record IndexStats(long count, boolean indexing, Map<String, Long> fieldDistribution) {}
