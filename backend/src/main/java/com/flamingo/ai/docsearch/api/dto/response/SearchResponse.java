package com.flamingo.ai.docsearch.api.dto.response;

import com.flamingo.ai.docsearch.domain.model.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private List<SearchHitResponse> hits;
  private String query;
  private long processingTimeMs;
  private long estimatedTotalHits;
  private int limit;
  private int offset;

  /** Creates a SearchResponse from a search result. */
  public static SearchResponse from(SearchResult result) {
    return SearchResponse.builder()
        .hits(result.hits().stream().map(SearchHitResponse::from).toList())
        .query(result.query())
        .processingTimeMs(result.processingTimeMs())
        .estimatedTotalHits(result.estimatedTotalHits())
        .limit(result.limit())
        .offset(result.offset())
        .build();
  }
}
