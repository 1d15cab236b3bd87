package com.flamingo.ai.docsearch.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * One search hit as returned by the index.
 *
 * @param id document id
 * @param score relevance score, {@code null} when not computed
 * @param source stored document fields, including {@code pageInfo}
 * @param highlights highlighted fragments per field; only fields with fragments are present
 */
public record RawHit(
    String id, Double score, Map<String, Object> source, Map<String, List<String>> highlights) {}
