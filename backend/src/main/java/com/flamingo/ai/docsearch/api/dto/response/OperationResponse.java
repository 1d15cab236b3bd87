package com.flamingo.ai.docsearch.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for operations that only report success. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationResponse {
  private boolean success;
  private String message;
}
