package com.flamingo.ai.docsearch.exception;

/** Exception thrown when the search index cannot parse a filter expression. */
public class InvalidFilterException extends RuntimeException {

  private final String filter;

  public InvalidFilterException(String filter, Throwable cause) {
    super("Invalid filter expression: " + filter, cause);
    this.filter = filter;
  }

  public String getFilter() {
    return filter;
  }
}
