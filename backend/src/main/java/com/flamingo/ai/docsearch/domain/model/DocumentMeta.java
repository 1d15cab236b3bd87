package com.flamingo.ai.docsearch.domain.model;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Metadata of one document row in a source table.
 *
 * <p>Owned by the relational store; the indexing pipeline only reads it. {@code name} carries the
 * file extension that selects the text extractor.
 */
@Value
@Builder(toBuilder = true)
public class DocumentMeta {

  /** Composite identity, {@code <sourceTable>:<rowId>}. */
  String id;

  String sourceTable;
  String rowId;
  String name;
  String title;
  String formNo;
  String mimeType;
  long sizeBytes;
  Instant modifiedTime;
  String path;
  @Builder.Default Map<String, String> metadata = Map.of();
}
