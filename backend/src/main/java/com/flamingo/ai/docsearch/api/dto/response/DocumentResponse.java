package com.flamingo.ai.docsearch.api.dto.response;

import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document metadata. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private String id;
  private String sourceTable;
  private String rowId;
  private String name;
  private String title;
  private String formNo;
  private String mimeType;
  private long size;
  private Instant modifiedTime;
  private String path;
  private Map<String, String> metadata;

  /** Creates a DocumentResponse from document metadata. */
  public static DocumentResponse fromMeta(DocumentMeta meta) {
    return DocumentResponse.builder()
        .id(meta.getId())
        .sourceTable(meta.getSourceTable())
        .rowId(meta.getRowId())
        .name(meta.getName())
        .title(meta.getTitle())
        .formNo(meta.getFormNo())
        .mimeType(meta.getMimeType())
        .size(meta.getSizeBytes())
        .modifiedTime(meta.getModifiedTime())
        .path(meta.getPath())
        .metadata(meta.getMetadata())
        .build();
  }
}
