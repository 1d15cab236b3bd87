package com.flamingo.ai.docsearch.exception;

/**
 * Exception thrown by a text extractor when a blob cannot be read.
 *
 * <p>Never leaves the extraction dispatcher; it becomes a failed outcome for that document.
 */
public class ExtractionException extends RuntimeException {

  private final String fileName;

  public ExtractionException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
  }

  public ExtractionException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
