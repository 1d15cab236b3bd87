package com.flamingo.ai.docsearch.exception;

/** Exception thrown when the search index service rejects an operation. */
public class SearchIndexException extends RuntimeException {

  private final String userMessage;

  public SearchIndexException(String message) {
    super(message);
    this.userMessage = "The search index rejected the request.";
  }

  public SearchIndexException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "The search index rejected the request.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
