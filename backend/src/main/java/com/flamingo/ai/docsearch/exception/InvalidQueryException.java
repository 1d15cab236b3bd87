package com.flamingo.ai.docsearch.exception;

/** Exception thrown when a search query is empty or its paging window is invalid. */
public class InvalidQueryException extends RuntimeException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
