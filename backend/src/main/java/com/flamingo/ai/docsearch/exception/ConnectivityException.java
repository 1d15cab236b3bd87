package com.flamingo.ai.docsearch.exception;

/**
 * A backing service (source store or search index) could not be reached.
 *
 * <p>Fatal to the current operation; the caller or operator retries.
 */
public abstract class ConnectivityException extends RuntimeException {

  private final String userMessage;

  protected ConnectivityException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
