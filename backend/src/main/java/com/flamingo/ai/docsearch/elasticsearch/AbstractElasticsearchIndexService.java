package com.flamingo.ai.docsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.docsearch.exception.SearchIndexException;
import com.flamingo.ai.docsearch.exception.SearchIndexUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides index creation and mapping validation, bulk upsert, delete-all, refresh and count.
 * Subclasses define the document-specific schema and conversion logic. Transport failures surface
 * as {@link SearchIndexUnavailableException}, server-side rejections as {@link
 * SearchIndexException}.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  /**
   * Converts a document entity to an Elasticsearch document map.
   *
   * @param entity the entity to convert
   * @return the Elasticsearch document map
   */
  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Extracts the document ID from the entity.
   *
   * @param entity the entity
   * @return the document ID
   */
  protected abstract String getDocumentId(T entity);

  /**
   * Returns the metric prefix for this index (e.g., "search_index").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void ensureIndex() {
    var indices = elasticsearchClient.indices();
    if (indices == null) {
      log.warn("No Elasticsearch client, index '{}' not checked", getIndexName());
      return;
    }
    try {
      if (indices.exists(e -> e.index(getIndexName())).value()) {
        reconcileMappings();
      } else {
        // dynamic=false keeps undeclared fields in _source without mapping them
        indices.create(
            CreateIndexRequest.of(
                c ->
                    c.index(getIndexName())
                        .mappings(
                            m ->
                                m.dynamic(DynamicMapping.False)
                                    .properties(defineIndexProperties()))));
        log.info("Created index '{}'", getIndexName());
      }
    } catch (IOException e) {
      throw new SearchIndexUnavailableException(
          "Cannot reach Elasticsearch to prepare index '" + getIndexName() + "'", e);
    } catch (ElasticsearchException e) {
      throw new SearchIndexException(
          "Elasticsearch refused to prepare index '" + getIndexName() + "': " + e.getMessage(), e);
    }
  }

  /**
   * Brings an existing index up to the declared schema.
   *
   * <p>New fields can be added to a live mapping but existing field types cannot change, so a type
   * change stops startup until the index is dropped.
   */
  private void reconcileMappings() throws IOException {
    Map<String, Property> declared = defineIndexProperties();
    var mapping =
        elasticsearchClient.indices().getMapping(g -> g.index(getIndexName())).get(getIndexName());
    Map<String, Property> live = mapping != null ? mapping.mappings().properties() : Map.of();

    MappingDiff diff = diffMappings(declared, live);
    if (!diff.conflicts().isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' maps fields with incompatible types "
              + diff.conflicts()
              + "; delete the index and restart to recreate it");
    }
    if (diff.missing().isEmpty()) {
      log.debug("Index '{}' mapping is up to date", getIndexName());
      return;
    }
    elasticsearchClient
        .indices()
        .putMapping(PutMappingRequest.of(p -> p.index(getIndexName()).properties(diff.missing())));
    log.info("Added fields {} to index '{}'", diff.missing().keySet(), getIndexName());
  }

  /**
   * Compares the declared schema with a live mapping.
   *
   * @return declared fields absent from the live mapping, and fields whose kind differs, rendered
   *     as {@code field: declared != live}
   */
  static MappingDiff diffMappings(Map<String, Property> declared, Map<String, Property> live) {
    Map<String, Property> missing = new TreeMap<>();
    List<String> conflicts = new ArrayList<>();
    declared.forEach(
        (field, property) -> {
          Property current = live.get(field);
          if (current == null) {
            missing.put(field, property);
          } else if (current._kind() != property._kind()) {
            conflicts.add(
                field + ": " + property._kind().jsonValue() + " != " + current._kind().jsonValue());
          }
        });
    Collections.sort(conflicts);
    return new MappingDiff(missing, conflicts);
  }

  /** Outcome of {@link #diffMappings}. */
  record MappingDiff(Map<String, Property> missing, List<String> conflicts) {}

  @Override
  public List<String> indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return List.of();
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      List<String> rejected = new ArrayList<>();
      if (response.errors()) {
        for (BulkResponseItem item : response.items()) {
          if (item.error() != null) {
            log.warn(
                "Document {} rejected by {}: {}", item.id(), getIndexName(), item.error().reason());
            rejected.add(item.id());
          }
        }
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment(rejected.size());
      }
      int accepted = documents.size() - rejected.size();
      log.debug("Indexed {} documents to {}", accepted, getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(accepted);
      return rejected;
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage());
      throw new SearchIndexUnavailableException(
          "Failed to index documents to " + getIndexName() + ": " + e.getMessage(), e);
    } catch (ElasticsearchException e) {
      log.error("Bulk request rejected by {}: {}", getIndexName(), e.getMessage());
      throw new SearchIndexException("Bulk request rejected: " + e.getMessage(), e);
    }
  }

  @Override
  public void deleteAll() {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d -> d.index(getIndexName()).query(q -> q.matchAll(m -> m)).refresh(true));
      long deleted = elasticsearchClient.deleteByQuery(request).deleted();
      log.info("Deleted {} documents from {}", deleted, getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
    } catch (IOException e) {
      throw new SearchIndexUnavailableException(
          "Failed to clear " + getIndexName() + ": " + e.getMessage(), e);
    } catch (ElasticsearchException e) {
      throw new SearchIndexException(
          "Failed to clear " + getIndexName() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  @Override
  public long count() {
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName())).count();
    } catch (IOException e) {
      throw new SearchIndexUnavailableException(
          "Failed to count documents of " + getIndexName() + ": " + e.getMessage(), e);
    } catch (ElasticsearchException e) {
      throw new SearchIndexException(
          "Count failed on " + getIndexName() + ": " + e.getMessage(), e);
    }
  }
}
