package com.flamingo.ai.docsearch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.docsearch.domain.model.IndexingRunResult;
import com.flamingo.ai.docsearch.domain.model.IndexingRunStats;
import com.flamingo.ai.docsearch.domain.model.RunStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a finished indexing run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexRunResponse {

  private boolean success;
  private RunStatus status;
  private boolean cancelled;
  private String message;
  private RunCounts stats;
  private Instant startedAt;
  private Instant finishedAt;

  /** Document counters of a run. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class RunCounts {
    private int total;
    private int indexed;
    private int failed;
    private int skipped;

    public static RunCounts from(IndexingRunStats.Snapshot snapshot) {
      return RunCounts.builder()
          .total(snapshot.total())
          .indexed(snapshot.indexed())
          .failed(snapshot.failed())
          .skipped(snapshot.skipped())
          .build();
    }
  }

  /** Creates an IndexRunResponse from a run result. */
  public static IndexRunResponse from(IndexingRunResult result) {
    return IndexRunResponse.builder()
        .success(result.isSuccess())
        .status(result.status())
        .cancelled(result.cancelled())
        .message(result.message())
        .stats(RunCounts.from(result.stats()))
        .startedAt(result.startedAt())
        .finishedAt(result.finishedAt())
        .build();
  }
}
