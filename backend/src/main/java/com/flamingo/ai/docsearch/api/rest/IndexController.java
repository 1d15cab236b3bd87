package com.flamingo.ai.docsearch.api.rest;

import com.flamingo.ai.docsearch.api.dto.request.IndexRequest;
import com.flamingo.ai.docsearch.api.dto.response.IndexRunResponse;
import com.flamingo.ai.docsearch.api.dto.response.IndexStatusResponse;
import com.flamingo.ai.docsearch.api.dto.response.OperationResponse;
import com.flamingo.ai.docsearch.domain.model.IndexingRunResult;
import com.flamingo.ai.docsearch.service.indexing.IndexingPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for indexing runs.
 *
 * <p>{@code POST /api/index} blocks until the run ends; {@code GET /api/index/status} reports
 * progress to callers that poll meanwhile.
 */
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
@Slf4j
public class IndexController {

  private final IndexingPipeline indexingPipeline;

  /** Runs a full indexing pass. Responds 503 when the run was aborted. */
  @PostMapping
  public ResponseEntity<IndexRunResponse> index(
      @RequestBody(required = false) IndexRequest request) {
    boolean clearExisting = request != null && request.isClearExisting();
    IndexingRunResult result = indexingPipeline.run(clearExisting);
    IndexRunResponse body = IndexRunResponse.from(result);
    if (!result.isSuccess()) {
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
    return ResponseEntity.ok(body);
  }

  /** Removes every document from the index. */
  @PostMapping("/clear")
  public ResponseEntity<OperationResponse> clear() {
    indexingPipeline.clearIndex();
    return ResponseEntity.ok(
        OperationResponse.builder().success(true).message("Index cleared successfully").build());
  }

  /** Requests cancellation of the active run. */
  @PostMapping("/cancel")
  public ResponseEntity<OperationResponse> cancel() {
    boolean cancelled = indexingPipeline.cancel();
    String message = cancelled ? "Cancellation requested" : "No indexing run is active";
    return ResponseEntity.ok(
        OperationResponse.builder().success(cancelled).message(message).build());
  }

  /** Returns the progress of the active run or the result of the last one. */
  @GetMapping("/status")
  public ResponseEntity<IndexStatusResponse> status() {
    return ResponseEntity.ok(IndexStatusResponse.from(indexingPipeline.progress()));
  }
}
