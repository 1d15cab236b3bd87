package com.flamingo.ai.docsearch.service.search;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.domain.model.PageText;
import com.flamingo.ai.docsearch.domain.model.SearchResult;
import com.flamingo.ai.docsearch.domain.model.SearchResultHit;
import com.flamingo.ai.docsearch.elasticsearch.RawHit;
import com.flamingo.ai.docsearch.elasticsearch.RawSearchResult;
import com.flamingo.ai.docsearch.extraction.DocumentFormat;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns raw index hits into the search response shape.
 *
 * <p>Each hit keeps its stored fields minus {@code pageInfo}, gains a highlighted copy of every
 * highlighted field, the list of fields with a match, and for paginated formats the page of the
 * first literal match.
 */
@Component
@Slf4j
public class QueryResultShaper {

  static final String PAGE_INFO = "pageInfo";
  private static final String MATCH_TAG = "<em>";
  private static final String FRAGMENT_SEPARATOR = " ... ";

  private final PageLocator pageLocator;
  private final int cropLength;

  @Autowired
  public QueryResultShaper(PageLocator pageLocator, DocSearchConfig config) {
    this(pageLocator, config.getSearch().getCropLength());
  }

  QueryResultShaper(PageLocator pageLocator, int cropLength) {
    this.pageLocator = pageLocator;
    this.cropLength = cropLength;
  }

  public SearchResult shape(
      RawSearchResult raw, String query, List<String> highlightFields, int limit, int offset) {
    List<SearchResultHit> hits = new ArrayList<>(raw.hits().size());
    for (RawHit hit : raw.hits()) {
      hits.add(shapeHit(hit, query, highlightFields));
    }
    return new SearchResult(hits, query, raw.tookMs(), raw.totalHits(), limit, offset);
  }

  private SearchResultHit shapeHit(RawHit hit, String query, List<String> highlightFields) {
    Map<String, Object> document = new LinkedHashMap<>(hit.source());
    Object pageInfo = document.remove(PAGE_INFO);

    Map<String, List<String>> highlights = hit.highlights() != null ? hit.highlights() : Map.of();
    Map<String, String> formatted = new LinkedHashMap<>();
    List<String> matchedFields = new ArrayList<>();
    for (String field : highlightFields) {
      List<String> fragments = highlights.get(field);
      if (fragments != null && !fragments.isEmpty()) {
        String joined = String.join(FRAGMENT_SEPARATOR, fragments);
        formatted.put(field, joined);
        if (joined.contains(MATCH_TAG)) {
          matchedFields.add(field);
        }
      } else if (document.get(field) != null) {
        formatted.put(field, crop(String.valueOf(document.get(field)), field));
      }
    }

    Integer pageNumber = null;
    boolean paginated =
        DocumentFormat.fromTag(String.valueOf(document.get("format")))
            .map(DocumentFormat::isPaginated)
            .orElse(false);
    if (paginated) {
      OptionalInt page = pageLocator.locate(toPages(pageInfo), query);
      pageNumber = page.isPresent() ? page.getAsInt() : null;
    }
    return new SearchResultHit(document, formatted, matchedFields, pageNumber, hit.score());
  }

  private String crop(String value, String field) {
    if (!"content".equals(field) || value.length() <= cropLength) {
      return value;
    }
    int end = value.lastIndexOf(' ', cropLength);
    return value.substring(0, end > 0 ? end : cropLength) + "…";
  }

  /** Reads the stored page list; malformed entries are ignored. */
  static List<PageText> toPages(Object pageInfo) {
    if (!(pageInfo instanceof List<?> entries)) {
      return List.of();
    }
    List<PageText> pages = new ArrayList<>(entries.size());
    for (Object entry : entries) {
      if (entry instanceof Map<?, ?> map
          && map.get("page") instanceof Number page
          && map.get("text") != null) {
        pages.add(new PageText(page.intValue(), map.get("text").toString()));
      } else {
        log.debug("Ignoring malformed page entry: {}", entry);
      }
    }
    return pages;
  }
}
