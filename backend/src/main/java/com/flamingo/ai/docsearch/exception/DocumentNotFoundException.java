package com.flamingo.ai.docsearch.exception;

/** Exception thrown when a document row or its content is not found. */
public class DocumentNotFoundException extends RuntimeException {

  private final String documentId;

  public DocumentNotFoundException(String documentId) {
    super("Document not found: " + documentId);
    this.documentId = documentId;
  }

  public DocumentNotFoundException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
