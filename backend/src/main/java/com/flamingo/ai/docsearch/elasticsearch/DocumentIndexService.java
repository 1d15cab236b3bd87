package com.flamingo.ai.docsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Highlight;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.domain.model.IndexStats;
import com.flamingo.ai.docsearch.domain.model.PageText;
import com.flamingo.ai.docsearch.exception.InvalidFilterException;
import com.flamingo.ai.docsearch.exception.InvalidQueryException;
import com.flamingo.ai.docsearch.exception.SearchIndexException;
import com.flamingo.ai.docsearch.exception.SearchIndexUnavailableException;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for searchable documents.
 *
 * <p>One flat index holds the records of every source table. Queries combine a typo-tolerant
 * multi-field match with phrase boosts derived from the {@link RankingRule} order, filter with a
 * query-string expression, and highlight matches with {@code <em>} tags.
 */
@Service
@Slf4j
public class DocumentIndexService extends AbstractElasticsearchIndexService<IndexRecord>
    implements SearchIndexClient {

  static final String PRE_TAG = "<em>";
  static final String POST_TAG = "</em>";
  private static final int PROXIMITY_SLOP = 3;

  /** Fields reported in the field distribution of {@link #stats()}. */
  private static final List<String> DISTRIBUTION_FIELDS =
      List.of(
          "sourceTable",
          "rowId",
          "name",
          "title",
          "formNo",
          "content",
          "path",
          "mimeType",
          "format",
          "sizeBytes",
          "modifiedTime",
          "metadata");

  private final String indexName;
  private final String textAnalyzer;
  private final int cropLength;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicInteger writesInFlight = new AtomicInteger();
  private volatile IndexSchema schema = IndexSchema.defaults();

  @Autowired
  public DocumentIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      DocSearchConfig config) {
    this(
        elasticsearchClient,
        meterRegistry,
        config.getIndex().getName(),
        config.getIndex().getTextAnalyzer(),
        config.getSearch().getCropLength());
  }

  /** Constructor for testing - allows setting index name, analyzer and crop length. */
  @VisibleForTesting
  public DocumentIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      String textAnalyzer,
      int cropLength) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.textAnalyzer = textAnalyzer;
    this.cropLength = cropLength;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected String getMetricPrefix() {
    return "search_index";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    if (!"standard".equals(textAnalyzer)) {
      log.warn("Using custom analyzer '{}'. Ensure it's installed in Elasticsearch.", textAnalyzer);
    }

    Map<String, Property> properties = new HashMap<>();
    // exact-match fields used by filters and sorting
    properties.put("id", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceTable", Property.of(p -> p.keyword(k -> k)));
    properties.put("rowId", Property.of(p -> p.keyword(k -> k)));
    properties.put("mimeType", Property.of(p -> p.keyword(k -> k)));
    properties.put("format", Property.of(p -> p.keyword(k -> k)));
    properties.put("sizeBytes", Property.of(p -> p.long_(l -> l)));
    properties.put("modifiedTime", Property.of(p -> p.date(d -> d)));
    properties.put("metadata", Property.of(p -> p.flattened(f -> f)));

    properties.put("name", Property.of(p -> p.text(textWithKeyword())));
    properties.put("formNo", Property.of(p -> p.text(textWithKeyword())));
    properties.put("title", Property.of(p -> p.text(analyzedText())));
    properties.put("path", Property.of(p -> p.text(analyzedText())));
    properties.put("content", Property.of(p -> p.text(analyzedText())));

    // stored in _source for page location, never searched
    properties.put("pageInfo", Property.of(p -> p.object(o -> o.enabled(false))));
    return properties;
  }

  private TextProperty analyzedText() {
    return TextProperty.of(t -> t.analyzer(textAnalyzer));
  }

  private TextProperty textWithKeyword() {
    return TextProperty.of(
        t -> t.analyzer(textAnalyzer).fields("keyword", f -> f.keyword(k -> k.ignoreAbove(256))));
  }

  @Override
  protected Map<String, Object> convertToDocument(IndexRecord record) {
    Map<String, Object> document = new HashMap<>();
    document.put("id", record.getId());
    document.put("sourceTable", record.getSourceTable());
    document.put("rowId", record.getRowId());
    document.put("name", record.getName());
    document.put("title", record.getTitle());
    document.put("mimeType", record.getMimeType());
    document.put("format", record.getFormat());
    document.put("sizeBytes", record.getSizeBytes());
    document.put("path", record.getPath());
    document.put("content", record.getContent());
    document.put("metadata", record.getMetadata());
    if (record.getFormNo() != null) {
      document.put("formNo", record.getFormNo());
    }
    if (record.getModifiedTime() != null) {
      document.put("modifiedTime", record.getModifiedTime().toString());
    }
    if (record.getPageInfo() != null && !record.getPageInfo().isEmpty()) {
      List<Map<String, Object>> pages = new ArrayList<>();
      for (PageText page : record.getPageInfo()) {
        pages.add(Map.of("page", page.page(), "text", page.text()));
      }
      document.put("pageInfo", pages);
    }
    return document;
  }

  @Override
  protected String getDocumentId(IndexRecord entity) {
    return entity.getId();
  }

  @Override
  public void configure(IndexSchema schema) {
    this.schema = schema;
    ensureIndex();
    log.info(
        "Index '{}' configured: searchable={}, ranking={}",
        indexName,
        schema.searchableFields().keySet(),
        schema.rankingRules());
  }

  @Override
  public IndexSchema schema() {
    return schema;
  }

  @Override
  @Timed(value = "search_index.upsert", description = "Time to upsert a batch of documents")
  @Retry(name = "elasticsearch")
  public List<String> upsertBatch(List<IndexRecord> records) {
    writeLock.lock();
    writesInFlight.incrementAndGet();
    try {
      return indexDocuments(records);
    } finally {
      writesInFlight.decrementAndGet();
      writeLock.unlock();
    }
  }

  @Override
  public void clear() {
    writeLock.lock();
    writesInFlight.incrementAndGet();
    try {
      deleteAll();
    } finally {
      writesInFlight.decrementAndGet();
      writeLock.unlock();
    }
  }

  @Override
  @Timed(value = "search_index.query", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch")
  public RawSearchResult query(SearchQuery query) {
    if (query.query() == null || query.query().isBlank()) {
      throw new InvalidQueryException("Query must not be empty");
    }
    if (query.limit() < 1) {
      throw new InvalidQueryException("Limit must be at least 1");
    }
    if (query.offset() < 0) {
      throw new InvalidQueryException("Offset must not be negative");
    }

    try {
      SearchRequest request = buildSearchRequest(query);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<RawHit> hits = mapHits(response.hits().hits());
      long totalHits =
          response.hits().total() != null ? response.hits().total().value() : hits.size();
      log.info(
          "[search] index={} query='{}' filters='{}' totalHits={} returned={}",
          indexName,
          query.query(),
          query.filters(),
          totalHits,
          hits.size());
      meterRegistry.counter(getMetricPrefix() + ".keyword_search").increment();
      return new RawSearchResult(hits, totalHits, response.took());
    } catch (IOException e) {
      log.error("Keyword search failed for {}: {}", indexName, e.getMessage());
      throw new SearchIndexUnavailableException("Search failed: " + e.getMessage(), e);
    } catch (ElasticsearchException e) {
      if (query.hasFilters() && e.status() == 400) {
        throw new InvalidFilterException(query.filters(), e);
      }
      log.error("Keyword search rejected by {}: {}", indexName, e.getMessage());
      throw new SearchIndexException("Search rejected: " + e.getMessage(), e);
    }
  }

  @VisibleForTesting
  SearchRequest buildSearchRequest(SearchQuery query) {
    IndexSchema current = schema;
    Query boolQuery = buildQuery(current, query);
    Highlight highlight = buildHighlight(current);
    return SearchRequest.of(
        s -> {
          s.index(indexName)
              .query(boolQuery)
              .highlight(highlight)
              .from(query.offset())
              .size(query.limit())
              .trackTotalHits(t -> t.enabled(true))
              .sort(so -> so.score(sc -> sc.order(SortOrder.Desc)));
          if (current.rankingRules().contains(RankingRule.RECENCY)) {
            s.sort(so -> so.field(f -> f.field("modifiedTime").order(SortOrder.Desc)));
          }
          return s;
        });
  }

  private Query buildQuery(IndexSchema current, SearchQuery query) {
    List<String> fields = current.boostedFields();
    String text = query.query().trim();
    BoolQuery.Builder bool = new BoolQuery.Builder();
    bool.must(
        m ->
            m.multiMatch(
                mm ->
                    mm.query(text)
                        .fields(fields)
                        .type(TextQueryType.BestFields)
                        .fuzziness("AUTO")
                        .lenient(true)));

    // earlier rules carry a larger boost
    List<RankingRule> rules = current.rankingRules();
    for (int i = 0; i < rules.size(); i++) {
      final float boost = rules.size() - i;
      switch (rules.get(i)) {
        case EXACTNESS ->
            bool.should(
                sh ->
                    sh.multiMatch(
                        mm ->
                            mm.query(text)
                                .fields(fields)
                                .type(TextQueryType.Phrase)
                                .lenient(true)
                                .boost(boost)));
        case PROXIMITY ->
            bool.should(
                sh ->
                    sh.multiMatch(
                        mm ->
                            mm.query(text)
                                .fields(fields)
                                .type(TextQueryType.Phrase)
                                .slop(PROXIMITY_SLOP)
                                .lenient(true)
                                .boost(boost)));
        default -> {
          // RELEVANCE is the must clause, RECENCY the sort tiebreak
        }
      }
    }

    if (query.hasFilters()) {
      bool.filter(f -> f.queryString(qs -> qs.query(query.filters())));
    }
    return Query.of(q -> q.bool(bool.build()));
  }

  private Highlight buildHighlight(IndexSchema current) {
    Highlight.Builder builder = new Highlight.Builder().preTags(PRE_TAG).postTags(POST_TAG);
    for (String field : current.highlightFields()) {
      if ("content".equals(field)) {
        builder.fields(
            field, f -> f.fragmentSize(cropLength).numberOfFragments(1).noMatchSize(cropLength));
      } else {
        builder.fields(field, f -> f.numberOfFragments(0));
      }
    }
    return builder.build();
  }

  private List<RawHit> mapHits(List<Hit<Map>> hits) {
    List<RawHit> results = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source() != null ? new LinkedHashMap<>(hit.source()) : null;
      if (source == null) {
        continue;
      }
      // _id is metadata and not part of _source
      source.put("id", hit.id());
      results.add(new RawHit(hit.id(), hit.score(), source, hit.highlight()));
    }
    return results;
  }

  @Override
  public IndexStats stats() {
    long count = count();
    Map<String, Long> distribution = new LinkedHashMap<>();
    try {
      SearchResponse<Void> response =
          elasticsearchClient.search(
              s -> {
                s.index(indexName).size(0);
                for (String field : DISTRIBUTION_FIELDS) {
                  s.aggregations(field, a -> a.filter(f -> f.exists(e -> e.field(field))));
                }
                return s;
              },
              Void.class);
      for (String field : DISTRIBUTION_FIELDS) {
        var aggregate = response.aggregations().get(field);
        long docCount = aggregate != null ? aggregate.filter().docCount() : 0L;
        if (docCount > 0) {
          distribution.put(field, docCount);
        }
      }
    } catch (IOException e) {
      throw new SearchIndexUnavailableException("Failed to read index stats: " + e.getMessage(), e);
    } catch (ElasticsearchException e) {
      throw new SearchIndexException("Index stats rejected: " + e.getMessage(), e);
    }
    return new IndexStats(count, writesInFlight.get() > 0, distribution);
  }
}
