package com.flamingo.ai.docsearch.domain.model;

/** Lifecycle of an indexing run. */
public enum RunStatus {
  IDLE,
  RUNNING,
  COMPLETED,
  ABORTED
}
