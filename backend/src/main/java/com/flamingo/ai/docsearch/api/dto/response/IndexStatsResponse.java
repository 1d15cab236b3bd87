package com.flamingo.ai.docsearch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.docsearch.domain.model.IndexStats;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for index statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexStatsResponse {

  private long numberOfDocuments;

  @JsonProperty("isIndexing")
  private boolean indexing;

  private Map<String, Long> fieldDistribution;

  /** Creates an IndexStatsResponse from index statistics. */
  public static IndexStatsResponse from(IndexStats stats) {
    return IndexStatsResponse.builder()
        .numberOfDocuments(stats.count())
        .indexing(stats.indexing())
        .fieldDistribution(stats.fieldDistribution())
        .build();
  }
}
