package com.flamingo.ai.docsearch.source;

import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import com.flamingo.ai.docsearch.exception.DocumentNotFoundException;
import com.flamingo.ai.docsearch.exception.MalformedIdentityException;
import com.flamingo.ai.docsearch.exception.SourceStoreUnavailableException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the relational tables that hold documents.
 *
 * <p>All methods throw {@link SourceStoreUnavailableException} when the store cannot be reached.
 */
public interface SourceStoreGateway {

  /** Configured source table names, in indexing order. */
  List<String> configuredTables();

  /**
   * Lists the metadata of every active document row of a table.
   *
   * @param table configured table name
   */
  List<DocumentMeta> listDocuments(String table);

  /**
   * Loads the binary content of a document.
   *
   * @param documentId composite identity
   * @throws MalformedIdentityException if the identity cannot be decoded
   * @throws DocumentNotFoundException if the row does not exist or holds no content
   */
  byte[] fetchBlob(String documentId);

  /**
   * Looks up the metadata of a single row, active or not.
   *
   * @param documentId composite identity
   * @throws MalformedIdentityException if the identity cannot be decoded
   */
  Optional<DocumentMeta> findDocument(String documentId);

  /**
   * Checks that the store answers queries.
   *
   * @return database product name and version
   */
  String testConnection();
}
