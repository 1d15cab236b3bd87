package com.flamingo.ai.docsearch.service.document;

import com.flamingo.ai.docsearch.domain.identity.DocumentIdentityCodec;
import com.flamingo.ai.docsearch.domain.model.DocumentContent;
import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import com.flamingo.ai.docsearch.domain.model.DocumentPage;
import com.flamingo.ai.docsearch.exception.DocumentNotFoundException;
import com.flamingo.ai.docsearch.exception.InvalidQueryException;
import com.flamingo.ai.docsearch.exception.MalformedIdentityException;
import com.flamingo.ai.docsearch.source.SourceStoreGateway;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of DocumentService backed by the source store gateway. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private final SourceStoreGateway sourceStore;
  private final DocumentIdentityCodec identityCodec;

  @Override
  @Timed(value = "document.get", description = "Time to look up document metadata")
  public DocumentMeta getDocument(String documentId) {
    requireKnownTable(documentId);
    return sourceStore
        .findDocument(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  public DocumentPage listDocuments(int limit, int offset) {
    if (limit < 1) {
      throw new InvalidQueryException("Limit must be at least 1");
    }
    if (offset < 0) {
      throw new InvalidQueryException("Offset must not be negative");
    }
    List<DocumentMeta> all = new ArrayList<>();
    for (String table : sourceStore.configuredTables()) {
      all.addAll(sourceStore.listDocuments(table));
    }
    int from = Math.min(offset, all.size());
    int to = (int) Math.min((long) from + limit, all.size());
    return new DocumentPage(List.copyOf(all.subList(from, to)), all.size(), limit, offset);
  }

  @Override
  @Timed(value = "document.content", description = "Time to load document content")
  public DocumentContent getContent(String documentId) {
    DocumentMeta meta = getDocument(documentId);
    byte[] content = sourceStore.fetchBlob(documentId);
    if (content.length == 0) {
      throw new DocumentNotFoundException(documentId, "File content not found: " + documentId);
    }
    log.debug("Loaded {} bytes for {}", content.length, documentId);
    return new DocumentContent(meta, content);
  }

  private void requireKnownTable(String documentId) {
    try {
      identityCodec.decode(documentId);
    } catch (MalformedIdentityException e) {
      if (e.isUnknownTable()) {
        throw new DocumentNotFoundException(documentId, e.getMessage());
      }
      throw e;
    }
  }
}
