package com.flamingo.ai.docsearch.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(MalformedIdentityException.class)
  public ResponseEntity<ApiError> handleMalformedIdentity(
      MalformedIdentityException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_identity");
    String errorId = generateErrorId();
    log.warn("Malformed identity [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.MALFORMED_IDENTITY, ex.getMessage(), request);
  }

  @ExceptionHandler(InvalidQueryException.class)
  public ResponseEntity<ApiError> handleInvalidQuery(
      InvalidQueryException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_query");
    String errorId = generateErrorId();
    log.warn("Invalid query [{}]: {}", errorId, ex.getMessage());

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_QUERY, ex.getMessage(), request);
  }

  @ExceptionHandler(InvalidFilterException.class)
  public ResponseEntity<ApiError> handleInvalidFilter(
      InvalidFilterException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_filter");
    String errorId = generateErrorId();
    log.warn("Invalid filter [{}]: {}", errorId, ex.getFilter());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_FILTER, ex.getMessage(), request);
  }

  @ExceptionHandler(IndexingBusyException.class)
  public ResponseEntity<ApiError> handleIndexingBusy(
      IndexingBusyException ex, HttpServletRequest request) {

    incrementErrorCounter("indexing_busy");
    String errorId = generateErrorId();
    log.info("Indexing busy [{}]: {}", errorId, ex.getMessage());

    return build(HttpStatus.CONFLICT, errorId, ApiError.INDEXING_BUSY, ex.getMessage(), request);
  }

  @ExceptionHandler(SearchIndexUnavailableException.class)
  public ResponseEntity<ApiError> handleSearchIndexUnavailable(
      SearchIndexUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("search_index_unavailable");
    String errorId = generateErrorId();
    log.error("Search index unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_INDEX_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiError> handleCircuitOpen(
      CallNotPermittedException ex, HttpServletRequest request) {

    incrementErrorCounter("search_index_circuit_open");
    String errorId = generateErrorId();
    log.warn("Search index circuit open [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_INDEX_UNAVAILABLE,
        "Search is temporarily unavailable. Please try again.",
        request);
  }

  @ExceptionHandler(SourceStoreUnavailableException.class)
  public ResponseEntity<ApiError> handleSourceStoreUnavailable(
      SourceStoreUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("source_store_unavailable");
    String errorId = generateErrorId();
    log.error("Source store unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SOURCE_STORE_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(SearchIndexException.class)
  public ResponseEntity<ApiError> handleSearchIndex(
      SearchIndexException ex, HttpServletRequest request) {

    incrementErrorCounter("search_index_error");
    String errorId = generateErrorId();
    log.error("Search index error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.SEARCH_INDEX_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request body is missing or malformed",
        request);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiError> handleArgumentTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid value for parameter '{}' [{}]: {}", ex.getName(), errorId, ex.getValue());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Invalid value for parameter '" + ex.getName() + "'",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
