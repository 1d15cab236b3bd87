package com.flamingo.ai.docsearch.domain.model;

import java.time.Instant;

/**
 * Outcome of a finished indexing run.
 *
 * @param status {@link RunStatus#COMPLETED} or {@link RunStatus#ABORTED}
 * @param stats counters collected up to the end of the run
 * @param cancelled whether the run stopped because it was cancelled
 * @param message abort reason, {@code null} for completed runs
 * @param startedAt run start
 * @param finishedAt run end
 */
public record IndexingRunResult(
    RunStatus status,
    IndexingRunStats.Snapshot stats,
    boolean cancelled,
    String message,
    Instant startedAt,
    Instant finishedAt) {

  public boolean isSuccess() {
    return status == RunStatus.COMPLETED;
  }
}
