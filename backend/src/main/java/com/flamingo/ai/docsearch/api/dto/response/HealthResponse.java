package com.flamingo.ai.docsearch.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for service health. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
  private String status;
  private String sourceStore;
  private String searchIndex;
  private Long documentsIndexed;
  private boolean indexingRunning;
  private LocalDateTime timestamp;
}
