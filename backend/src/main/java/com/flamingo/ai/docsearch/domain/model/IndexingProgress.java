package com.flamingo.ai.docsearch.domain.model;

import java.time.Instant;

/**
 * Live view of the indexing pipeline.
 *
 * @param status {@link RunStatus#RUNNING} while a run is active, otherwise the last run's status
 *     or {@link RunStatus#IDLE}
 * @param stats counters of the active run, or of the last run when idle
 * @param processed documents dispatched so far in the active run
 * @param currentDocument name of the document dispatched most recently
 * @param startedAt start of the active run
 * @param lastResult result of the last finished run, {@code null} before the first one
 */
public record IndexingProgress(
    RunStatus status,
    IndexingRunStats.Snapshot stats,
    int processed,
    String currentDocument,
    Instant startedAt,
    IndexingRunResult lastResult) {}
