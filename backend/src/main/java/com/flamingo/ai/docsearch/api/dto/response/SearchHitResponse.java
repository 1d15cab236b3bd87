package com.flamingo.ai.docsearch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.docsearch.domain.model.SearchResultHit;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One search hit: the stored document fields at top level plus highlight data.
 *
 * <p>Serialized as e.g. {@code {"id": "FORMS_MASTER:1", "name": ..., "_formatted": {...},
 * "_matchedFields": [...], "pageNumber": 3, "score": 1.7}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchHitResponse {

  private Map<String, Object> document;

  @JsonProperty("_formatted")
  private Map<String, String> formatted;

  @JsonProperty("_matchedFields")
  private List<String> matchedFields;

  private Integer pageNumber;
  private Double score;

  /** Stored fields are written at the top level of the hit. */
  @JsonAnyGetter
  public Map<String, Object> getDocument() {
    return document;
  }

  /** Creates a SearchHitResponse from a shaped hit. */
  public static SearchHitResponse from(SearchResultHit hit) {
    return SearchHitResponse.builder()
        .document(hit.document())
        .formatted(hit.formatted())
        .matchedFields(hit.matchedFields())
        .pageNumber(hit.pageNumber())
        .score(hit.score())
        .build();
  }
}
