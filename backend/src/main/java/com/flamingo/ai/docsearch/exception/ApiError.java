package com.flamingo.ai.docsearch.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String MALFORMED_IDENTITY = "DOCUMENT_002";
  public static final String INVALID_QUERY = "SEARCH_001";
  public static final String INVALID_FILTER = "SEARCH_002";
  public static final String SEARCH_INDEX_UNAVAILABLE = "SEARCH_003";
  public static final String SEARCH_INDEX_ERROR = "SEARCH_004";
  public static final String SOURCE_STORE_UNAVAILABLE = "SOURCE_001";
  public static final String INDEXING_BUSY = "INDEXING_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
