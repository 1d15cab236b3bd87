package com.flamingo.ai.docsearch.elasticsearch;

import com.flamingo.ai.docsearch.domain.model.PageText;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One searchable document as stored in the index.
 *
 * <p>Built by the indexing pipeline from a source row and its extracted text. {@code pageInfo} is
 * stored for page location but never searched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexRecord {

  /** Composite identity, also the Elasticsearch {@code _id}. */
  private String id;

  private String sourceTable;
  private String rowId;
  private String name;
  private String title;
  private String formNo;
  private String mimeType;
  private long sizeBytes;
  private Instant modifiedTime;
  private String path;
  @Builder.Default private Map<String, String> metadata = Map.of();

  /** Extraction format tag, e.g. {@code pdf}. */
  private String format;

  @Builder.Default private String content = "";
  @Builder.Default private List<PageText> pageInfo = List.of();
}
