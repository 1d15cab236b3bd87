package com.flamingo.ai.docsearch.elasticsearch;

import java.util.List;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /**
   * Creates the index from the declared schema, or adds declared fields an existing index lacks.
   *
   * @throws IllegalStateException if the existing index maps a declared field with another type
   */
  void ensureIndex();

  /**
   * Indexes multiple documents in bulk, replacing documents with the same ID.
   *
   * @param documents the documents to index
   * @return IDs of the documents the index rejected individually
   */
  List<ID> indexDocuments(List<T> documents);

  /** Deletes every document of the index. */
  void deleteAll();

  /**
   * Refreshes the index to make recent changes visible for search.
   *
   * <p>Useful after bulk indexing operations to ensure documents are immediately searchable.
   */
  void refresh();

  /** Number of documents currently searchable. */
  long count();

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
