package com.flamingo.ai.docsearch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.docsearch.domain.model.IndexingProgress;
import com.flamingo.ai.docsearch.domain.model.RunStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the progress of the indexing pipeline. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexStatusResponse {

  private RunStatus status;
  private boolean running;
  private IndexRunResponse.RunCounts stats;
  private int processed;
  private String currentDocument;
  private Instant startedAt;
  private IndexRunResponse lastRun;

  /** Creates an IndexStatusResponse from the pipeline progress. */
  public static IndexStatusResponse from(IndexingProgress progress) {
    return IndexStatusResponse.builder()
        .status(progress.status())
        .running(progress.status() == RunStatus.RUNNING)
        .stats(IndexRunResponse.RunCounts.from(progress.stats()))
        .processed(progress.processed())
        .currentDocument(progress.currentDocument())
        .startedAt(progress.startedAt())
        .lastRun(
            progress.lastResult() != null ? IndexRunResponse.from(progress.lastResult()) : null)
        .build();
  }
}
