package com.flamingo.ai.docsearch.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a full-text search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  /** Query text; a blank query is rejected by the search service. */
  @Size(max = 1000, message = "Query must not exceed 1000 characters")
  private String query;

  private Integer limit;
  private Integer offset;

  /** Optional filter, e.g. {@code sourceTable:FORMS_MASTER AND metadata.department:HR}. */
  @Size(max = 2000, message = "Filters must not exceed 2000 characters")
  private String filters;
}
