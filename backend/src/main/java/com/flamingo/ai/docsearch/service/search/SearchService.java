package com.flamingo.ai.docsearch.service.search;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.domain.model.IndexStats;
import com.flamingo.ai.docsearch.domain.model.SearchResult;
import com.flamingo.ai.docsearch.elasticsearch.RawSearchResult;
import com.flamingo.ai.docsearch.elasticsearch.SearchIndexClient;
import com.flamingo.ai.docsearch.elasticsearch.SearchQuery;
import com.flamingo.ai.docsearch.exception.InvalidQueryException;
import com.flamingo.ai.docsearch.service.indexing.IndexingPipeline;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Runs user queries against the document index and reports index statistics. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchService {

  private final SearchIndexClient searchIndex;
  private final QueryResultShaper resultShaper;
  private final IndexingPipeline indexingPipeline;
  private final DocSearchConfig config;

  /**
   * Searches the index.
   *
   * @param query query text, must not be blank
   * @param limit window size; defaults when {@code null}, capped at the configured maximum
   * @param offset window start; {@code 0} when {@code null}
   * @param filters optional filter expression
   * @throws InvalidQueryException if the query is blank, the limit below 1 or the offset negative
   */
  @Timed(value = "search.query", description = "Time to run and shape a search")
  public SearchResult search(String query, Integer limit, Integer offset, String filters) {
    if (query == null || query.isBlank()) {
      throw new InvalidQueryException("Query must not be empty");
    }
    int effectiveLimit = limit != null ? limit : config.getSearch().getDefaultLimit();
    if (effectiveLimit < 1) {
      throw new InvalidQueryException("Limit must be at least 1");
    }
    effectiveLimit = Math.min(effectiveLimit, config.getSearch().getMaxLimit());
    int effectiveOffset = offset != null ? offset : 0;
    if (effectiveOffset < 0) {
      throw new InvalidQueryException("Offset must not be negative");
    }

    RawSearchResult raw =
        searchIndex.query(new SearchQuery(query, effectiveLimit, effectiveOffset, filters));
    log.debug("Query '{}' matched {} documents", query, raw.totalHits());
    return resultShaper.shape(
        raw, query, searchIndex.schema().highlightFields(), effectiveLimit, effectiveOffset);
  }

  /** Index statistics; {@code indexing} is also true while an indexing run is active. */
  public IndexStats stats() {
    IndexStats stats = searchIndex.stats();
    return new IndexStats(
        stats.count(), stats.indexing() || indexingPipeline.isRunning(), stats.fieldDistribution());
  }
}
