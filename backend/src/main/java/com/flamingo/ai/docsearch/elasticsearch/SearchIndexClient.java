package com.flamingo.ai.docsearch.elasticsearch;

import com.flamingo.ai.docsearch.domain.model.IndexStats;
import com.flamingo.ai.docsearch.exception.InvalidFilterException;
import com.flamingo.ai.docsearch.exception.InvalidQueryException;
import java.util.List;

/**
 * The document index as seen by the indexing pipeline and the search layer.
 *
 * <p>Writes ({@link #upsertBatch} and {@link #clear}) never overlap.
 */
public interface SearchIndexClient {

  /** Applies the schema, creating the index or adding missing fields. Idempotent. */
  void configure(IndexSchema schema);

  /** The schema queries currently run with. */
  IndexSchema schema();

  /**
   * Inserts or replaces records by id.
   *
   * @return ids of the records the index rejected individually
   */
  List<String> upsertBatch(List<IndexRecord> records);

  /**
   * Runs a keyword query.
   *
   * @throws InvalidQueryException if the query is blank or the window is invalid
   * @throws InvalidFilterException if the filter expression cannot be parsed
   */
  RawSearchResult query(SearchQuery query);

  IndexStats stats();

  /** Removes every record. */
  void clear();

  /** Makes all writes so far visible to queries. */
  void refresh();
}
