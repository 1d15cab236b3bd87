package com.flamingo.ai.docsearch.api.dto.response;

import com.flamingo.ai.docsearch.domain.model.DocumentPage;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a window of the document listing. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentListResponse {

  private List<DocumentResponse> documents;
  private int total;
  private int limit;
  private int offset;

  public static DocumentListResponse from(DocumentPage page) {
    return DocumentListResponse.builder()
        .documents(page.documents().stream().map(DocumentResponse::fromMeta).toList())
        .total(page.total())
        .limit(page.limit())
        .offset(page.offset())
        .build();
  }
}
