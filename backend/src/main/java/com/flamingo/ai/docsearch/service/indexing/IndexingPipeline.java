package com.flamingo.ai.docsearch.service.indexing;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import com.flamingo.ai.docsearch.domain.model.IndexingProgress;
import com.flamingo.ai.docsearch.domain.model.IndexingRunResult;
import com.flamingo.ai.docsearch.domain.model.IndexingRunStats;
import com.flamingo.ai.docsearch.domain.model.RunStatus;
import com.flamingo.ai.docsearch.elasticsearch.IndexRecord;
import com.flamingo.ai.docsearch.elasticsearch.SearchIndexClient;
import com.flamingo.ai.docsearch.exception.ConnectivityException;
import com.flamingo.ai.docsearch.exception.IndexingBusyException;
import com.flamingo.ai.docsearch.exception.SearchIndexException;
import com.flamingo.ai.docsearch.extraction.ExtractionOutcome;
import com.flamingo.ai.docsearch.extraction.TextExtractionDispatcher;
import com.flamingo.ai.docsearch.source.SourceStoreGateway;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Builds the search index from every configured source table.
 *
 * <p>A run lists all documents, fetches and extracts them on the extraction worker pool, and
 * flushes fixed-size batches to the index on the calling thread in listing order. Only one run
 * (or index clear) executes at a time; a concurrent request fails with {@link
 * IndexingBusyException}.
 *
 * <p>Per-document problems are counted and never stop the run. Losing the source store while
 * listing or the index while flushing aborts it; batches flushed before stay indexed.
 */
@Service
@Slf4j
public class IndexingPipeline {

  private final SourceStoreGateway sourceStore;
  private final TextExtractionDispatcher extractionDispatcher;
  private final SearchIndexClient searchIndex;
  private final AsyncTaskExecutor extractionExecutor;
  private final MeterRegistry meterRegistry;
  private final int batchSize;
  private final Duration documentTimeout;
  private final boolean indexEmptyContent;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
  private volatile IndexingRunStats currentStats;
  private volatile Instant currentStartedAt;
  private volatile IndexingRunResult lastResult;

  public IndexingPipeline(
      SourceStoreGateway sourceStore,
      TextExtractionDispatcher extractionDispatcher,
      SearchIndexClient searchIndex,
      @Qualifier("extractionExecutor") AsyncTaskExecutor extractionExecutor,
      MeterRegistry meterRegistry,
      DocSearchConfig config) {
    this.sourceStore = sourceStore;
    this.extractionDispatcher = extractionDispatcher;
    this.searchIndex = searchIndex;
    this.extractionExecutor = extractionExecutor;
    this.meterRegistry = meterRegistry;
    this.batchSize = Math.max(1, config.getIndexing().getBatchSize());
    this.documentTimeout = config.getIndexing().getDocumentTimeout();
    this.indexEmptyContent = config.getIndexing().isIndexEmptyContent();
  }

  /**
   * Runs a full indexing pass and blocks until it ends.
   *
   * @param clearExisting remove every indexed record before indexing
   * @return the completed or aborted run; never {@code null}
   * @throws IndexingBusyException if a run or clear is already in progress
   */
  public IndexingRunResult run(boolean clearExisting) {
    if (!running.compareAndSet(false, true)) {
      throw new IndexingBusyException("An indexing run is already in progress");
    }
    cancelRequested.set(false);
    IndexingRunStats stats = new IndexingRunStats();
    Instant startedAt = Instant.now();
    currentStats = stats;
    currentStartedAt = startedAt;
    Timer.Sample sample = Timer.start(meterRegistry);
    log.info("Indexing run started (clearExisting={})", clearExisting);

    IndexingRunResult result;
    try {
      result = execute(clearExisting, stats, startedAt);
    } catch (ConnectivityException | SearchIndexException e) {
      log.error("Indexing run aborted: {}", e.getMessage(), e);
      result = finish(RunStatus.ABORTED, stats, false, e.getMessage(), startedAt);
    } finally {
      currentStats = null;
      currentStartedAt = null;
      running.set(false);
    }

    lastResult = result;
    sample.stop(meterRegistry.timer("indexing.run", "status", result.status().name()));
    IndexingRunStats.Snapshot snapshot = result.stats();
    log.info(
        "Indexing run {}: total={}, indexed={}, failed={}, skipped={}",
        result.status(),
        snapshot.total(),
        snapshot.indexed(),
        snapshot.failed(),
        snapshot.skipped());
    return result;
  }

  private IndexingRunResult execute(
      boolean clearExisting, IndexingRunStats stats, Instant startedAt) {
    if (clearExisting) {
      searchIndex.clear();
      log.info("Cleared existing index before run");
    }

    List<DocumentMeta> documents = listAllDocuments();
    stats.addToTotal(documents.size());
    log.info("Found {} documents to process", documents.size());

    List<IndexRecord> batch = new ArrayList<>(batchSize);
    for (int start = 0; start < documents.size(); start += batchSize) {
      if (cancelRequested.get()) {
        log.warn("Indexing run cancelled after {} documents", stats.processed());
        flush(batch, stats);
        searchIndex.refresh();
        return finish(RunStatus.ABORTED, stats, true, "Cancelled", startedAt);
      }
      List<DocumentMeta> window =
          documents.subList(start, Math.min(start + batchSize, documents.size()));
      for (IndexRecord record : processWindow(window, stats)) {
        batch.add(record);
        if (batch.size() >= batchSize) {
          flush(batch, stats);
        }
      }
    }
    flush(batch, stats);
    searchIndex.refresh();
    return finish(RunStatus.COMPLETED, stats, false, null, startedAt);
  }

  private List<DocumentMeta> listAllDocuments() {
    List<DocumentMeta> documents = new ArrayList<>();
    for (String table : sourceStore.configuredTables()) {
      documents.addAll(sourceStore.listDocuments(table));
    }
    return documents;
  }

  /** Fetches and extracts a window of documents in parallel; returns records in window order. */
  private List<IndexRecord> processWindow(List<DocumentMeta> window, IndexingRunStats stats) {
    List<Future<PreparedDocument>> futures = new ArrayList<>(window.size());
    for (DocumentMeta document : window) {
      stats.recordProcessed(document.getName());
      try {
        futures.add(extractionExecutor.submit(() -> prepare(document)));
      } catch (TaskRejectedException e) {
        log.warn("Extraction rejected for '{}': {}", document.getName(), e.getMessage());
        futures.add(null);
      }
    }

    List<IndexRecord> records = new ArrayList<>();
    for (int i = 0; i < window.size(); i++) {
      DocumentMeta document = window.get(i);
      PreparedDocument prepared = await(document, futures.get(i));
      switch (prepared.outcome()) {
        case INDEX -> records.add(prepared.record());
        case SKIP -> {
          stats.recordSkipped();
          countDocument("skipped");
        }
        case FAIL -> {
          log.warn("Failed to process '{}': {}", document.getName(), prepared.reason());
          stats.recordFailed();
          countDocument("failed");
        }
      }
    }
    return records;
  }

  private PreparedDocument await(DocumentMeta document, Future<PreparedDocument> future) {
    if (future == null) {
      return PreparedDocument.fail("extraction pool rejected the document");
    }
    try {
      return future.get(documentTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      return PreparedDocument.fail("timed out after " + documentTimeout);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return PreparedDocument.fail(cause.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      cancelRequested.set(true);
      return PreparedDocument.fail("interrupted while processing " + document.getId());
    }
  }

  /** Runs on an extraction worker. */
  private PreparedDocument prepare(DocumentMeta document) {
    if (extractionDispatcher.formatOf(document.getName()).isEmpty()) {
      log.debug("Skipping '{}': unsupported format", document.getName());
      return PreparedDocument.skip();
    }

    byte[] blob;
    try {
      blob = sourceStore.fetchBlob(document.getId());
    } catch (RuntimeException e) {
      return PreparedDocument.fail("download failed: " + e.getMessage());
    }
    if (blob == null || blob.length == 0) {
      return PreparedDocument.fail("empty content");
    }

    ExtractionOutcome outcome = extractionDispatcher.dispatch(document.getName(), blob);
    return switch (outcome.status()) {
      case UNSUPPORTED -> PreparedDocument.skip();
      case FAILED -> PreparedDocument.fail(outcome.reason());
      case EXTRACTED -> {
        if (outcome.text().isEmpty() && !indexEmptyContent) {
          log.debug("Skipping '{}': no text extracted", document.getName());
          yield PreparedDocument.skip();
        }
        yield PreparedDocument.index(toRecord(document, outcome));
      }
    };
  }

  private IndexRecord toRecord(DocumentMeta document, ExtractionOutcome outcome) {
    return IndexRecord.builder()
        .id(document.getId())
        .sourceTable(document.getSourceTable())
        .rowId(document.getRowId())
        .name(document.getName())
        .title(document.getTitle())
        .formNo(document.getFormNo())
        .mimeType(document.getMimeType())
        .sizeBytes(document.getSizeBytes())
        .modifiedTime(document.getModifiedTime())
        .path(document.getPath())
        .metadata(document.getMetadata())
        .format(outcome.format().tag())
        .content(outcome.text())
        .pageInfo(outcome.format().isPaginated() ? outcome.pageInfo() : List.of())
        .build();
  }

  private void flush(List<IndexRecord> batch, IndexingRunStats stats) {
    if (batch.isEmpty()) {
      return;
    }
    log.info("Indexing batch of {} documents...", batch.size());
    List<IndexRecord> toFlush = List.copyOf(batch);
    batch.clear();
    List<String> rejected;
    try {
      rejected = searchIndex.upsertBatch(toFlush);
    } catch (RuntimeException e) {
      stats.recordFailed(toFlush.size());
      countDocument("failed", toFlush.size());
      throw e;
    }

    Set<String> rejectedIds = new HashSet<>(rejected);
    int failed = (int) toFlush.stream().filter(r -> rejectedIds.contains(r.getId())).count();
    int indexed = toFlush.size() - failed;
    stats.recordIndexed(indexed);
    stats.recordFailed(failed);
    countDocument("indexed", indexed);
    countDocument("failed", failed);
  }

  private IndexingRunResult finish(
      RunStatus status,
      IndexingRunStats stats,
      boolean cancelled,
      String message,
      Instant startedAt) {
    return new IndexingRunResult(
        status, stats.snapshot(), cancelled, message, startedAt, Instant.now());
  }

  private void countDocument(String outcome) {
    countDocument(outcome, 1);
  }

  private void countDocument(String outcome, int amount) {
    if (amount > 0) {
      meterRegistry.counter("indexing.documents", "outcome", outcome).increment(amount);
    }
  }

  /**
   * Requests cancellation of the active run. The run stops before the next window of documents.
   *
   * @return {@code true} if a run was active
   */
  public boolean cancel() {
    if (!running.get()) {
      return false;
    }
    cancelRequested.set(true);
    log.info("Cancellation requested for the active indexing run");
    return true;
  }

  /**
   * Removes every record from the index.
   *
   * @throws IndexingBusyException if a run is active
   */
  public void clearIndex() {
    if (!running.compareAndSet(false, true)) {
      throw new IndexingBusyException("Cannot clear the index while an indexing run is active");
    }
    try {
      searchIndex.clear();
      log.info("Index cleared");
    } finally {
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public IndexingProgress progress() {
    IndexingRunStats stats = currentStats;
    IndexingRunResult last = lastResult;
    if (stats != null) {
      return new IndexingProgress(
          RunStatus.RUNNING,
          stats.snapshot(),
          stats.processed(),
          stats.currentDocument(),
          currentStartedAt,
          last);
    }
    if (last != null) {
      return new IndexingProgress(last.status(), last.stats(), 0, null, null, last);
    }
    return new IndexingProgress(
        RunStatus.IDLE, IndexingRunStats.Snapshot.EMPTY, 0, null, null, null);
  }

  /** Result of fetching and extracting one document. */
  private record PreparedDocument(Outcome outcome, IndexRecord record, String reason) {

    enum Outcome {
      INDEX,
      SKIP,
      FAIL
    }

    static PreparedDocument index(IndexRecord record) {
      return new PreparedDocument(Outcome.INDEX, record, null);
    }

    static PreparedDocument skip() {
      return new PreparedDocument(Outcome.SKIP, null, null);
    }

    static PreparedDocument fail(String reason) {
      return new PreparedDocument(Outcome.FAIL, null, reason);
    }
  }
}
