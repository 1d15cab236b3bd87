package com.flamingo.ai.docsearch.exception;

/** Exception thrown when the relational source store cannot be reached. */
public class SourceStoreUnavailableException extends ConnectivityException {

  public SourceStoreUnavailableException(String message, Throwable cause) {
    super(message, "The document store is temporarily unavailable. Please try again.", cause);
  }
}
