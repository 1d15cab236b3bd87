package com.flamingo.ai.docsearch.exception;

/** Exception thrown when the search index service cannot be reached. */
public class SearchIndexUnavailableException extends ConnectivityException {

  public SearchIndexUnavailableException(String message, Throwable cause) {
    super(message, "Search is temporarily unavailable. Please try again.", cause);
  }
}
