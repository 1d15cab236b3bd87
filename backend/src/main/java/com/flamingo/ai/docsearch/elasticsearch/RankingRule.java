package com.flamingo.ai.docsearch.elasticsearch;

/**
 * Ranking criteria applied to keyword queries, most important first in {@link IndexSchema}.
 *
 * <ul>
 *   <li>{@code EXACTNESS}: exact phrase matches score higher
 *   <li>{@code PROXIMITY}: query terms close to each other score higher
 *   <li>{@code RELEVANCE}: BM25 over the weighted searchable fields, typo tolerant
 *   <li>{@code RECENCY}: newer documents win ties
 * </ul>
 */
public enum RankingRule {
  EXACTNESS,
  PROXIMITY,
  RELEVANCE,
  RECENCY
}
