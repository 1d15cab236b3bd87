package com.flamingo.ai.docsearch.domain.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counters of one indexing run.
 *
 * <p>Written by the run thread only and read concurrently by progress queries. At completion
 * {@code total == indexed + failed + skipped}.
 */
public class IndexingRunStats {

  private final AtomicInteger total = new AtomicInteger();
  private final AtomicInteger indexed = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final AtomicInteger skipped = new AtomicInteger();
  private final AtomicInteger processed = new AtomicInteger();
  private final AtomicReference<String> currentDocument = new AtomicReference<>();

  public void addToTotal(int count) {
    total.addAndGet(count);
  }

  public void recordIndexed(int count) {
    indexed.addAndGet(count);
  }

  public void recordFailed() {
    failed.incrementAndGet();
  }

  public void recordFailed(int count) {
    failed.addAndGet(count);
  }

  public void recordSkipped() {
    skipped.incrementAndGet();
  }

  /** Marks a document as dispatched for fetch and extraction. */
  public void recordProcessed(String documentName) {
    processed.incrementAndGet();
    currentDocument.set(documentName);
  }

  public Snapshot snapshot() {
    return new Snapshot(total.get(), indexed.get(), failed.get(), skipped.get());
  }

  public int processed() {
    return processed.get();
  }

  public String currentDocument() {
    return currentDocument.get();
  }

  /** Immutable view of the counters. */
  public record Snapshot(int total, int indexed, int failed, int skipped) {

    public static final Snapshot EMPTY = new Snapshot(0, 0, 0, 0);

    public boolean isBalanced() {
      return total == indexed + failed + skipped;
    }
  }
}
