package com.flamingo.ai.docsearch.api.rest;

import com.flamingo.ai.docsearch.api.dto.response.DocumentListResponse;
import com.flamingo.ai.docsearch.api.dto.response.DocumentResponse;
import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.domain.model.DocumentContent;
import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import com.flamingo.ai.docsearch.service.document.DocumentService;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for document metadata and content.
 *
 * <p>Content endpoints return a {@link Resource}, so Spring MVC answers {@code Range} requests
 * with {@code 206 Partial Content}.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;
  private final DocSearchConfig config;

  /** Gets the metadata of a document. */
  @GetMapping("/document/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable String documentId) {
    DocumentMeta meta = documentService.getDocument(documentId);
    return ResponseEntity.ok(DocumentResponse.fromMeta(meta));
  }

  /** Lists documents across all source tables. */
  @GetMapping("/documents")
  public ResponseEntity<DocumentListResponse> listDocuments(
      @RequestParam(required = false) Integer limit,
      @RequestParam(defaultValue = "0") int offset) {
    int effectiveLimit = limit != null ? limit : config.getSearch().getDefaultListingLimit();
    return ResponseEntity.ok(
        DocumentListResponse.from(documentService.listDocuments(effectiveLimit, offset)));
  }

  /** Streams a document for embedding in a viewer. */
  @GetMapping("/document/{documentId}/proxy")
  public ResponseEntity<Resource> proxyDocument(@PathVariable String documentId) {
    return contentResponse(documentService.getContent(documentId), true);
  }

  /** Downloads a document, as an attachment unless {@code inline=true}. */
  @GetMapping("/document/{documentId}/download")
  public ResponseEntity<Resource> downloadDocument(
      @PathVariable String documentId, @RequestParam(defaultValue = "false") boolean inline) {
    return contentResponse(documentService.getContent(documentId), inline);
  }

  private ResponseEntity<Resource> contentResponse(DocumentContent content, boolean inline) {
    DocumentMeta meta = content.meta();
    ContentDisposition disposition =
        (inline ? ContentDisposition.inline() : ContentDisposition.attachment())
            .filename(meta.getName(), StandardCharsets.UTF_8)
            .build();
    return ResponseEntity.ok()
        .contentType(mediaTypeOf(meta))
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .header(HttpHeaders.ACCEPT_RANGES, "bytes")
        .cacheControl(CacheControl.noCache())
        .body(new ByteArrayResource(content.content()));
  }

  private static MediaType mediaTypeOf(DocumentMeta meta) {
    try {
      return MediaType.parseMediaType(meta.getMimeType());
    } catch (IllegalArgumentException e) {
      return MediaType.APPLICATION_OCTET_STREAM;
    }
  }
}
