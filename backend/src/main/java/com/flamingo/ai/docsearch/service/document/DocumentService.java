package com.flamingo.ai.docsearch.service.document;

import com.flamingo.ai.docsearch.domain.model.DocumentContent;
import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import com.flamingo.ai.docsearch.domain.model.DocumentPage;

/** Service interface for reading documents from the source store. */
public interface DocumentService {

  /**
   * Gets the metadata of a document.
   *
   * @param documentId composite identity
   * @return the document metadata
   * @throws com.flamingo.ai.docsearch.exception.DocumentNotFoundException if the table or row is
   *     unknown
   * @throws com.flamingo.ai.docsearch.exception.MalformedIdentityException if the identity is
   *     malformed
   */
  DocumentMeta getDocument(String documentId);

  /**
   * Lists active documents across all source tables.
   *
   * @param limit maximum number of documents
   * @param offset number of documents to skip
   * @return the requested window and the overall total
   */
  DocumentPage listDocuments(int limit, int offset);

  /**
   * Loads the binary content of a document.
   *
   * @param documentId composite identity
   * @return metadata and content
   * @throws com.flamingo.ai.docsearch.exception.DocumentNotFoundException if the document or its
   *     content does not exist
   */
  DocumentContent getContent(String documentId);
}
