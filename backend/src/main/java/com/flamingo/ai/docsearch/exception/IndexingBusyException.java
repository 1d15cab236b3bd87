package com.flamingo.ai.docsearch.exception;

/** Exception thrown when an indexing operation is requested while a run is active. */
public class IndexingBusyException extends RuntimeException {

  public IndexingBusyException(String message) {
    super(message);
  }
}
