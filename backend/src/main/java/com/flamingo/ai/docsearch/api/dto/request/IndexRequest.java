package com.flamingo.ai.docsearch.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting an indexing run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexRequest {

  /** Clear the whole index before indexing. */
  @JsonProperty("clear_existing")
  private boolean clearExisting;
}
