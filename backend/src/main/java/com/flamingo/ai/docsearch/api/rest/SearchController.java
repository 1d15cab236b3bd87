package com.flamingo.ai.docsearch.api.rest;

import com.flamingo.ai.docsearch.api.dto.request.SearchRequest;
import com.flamingo.ai.docsearch.api.dto.response.IndexStatsResponse;
import com.flamingo.ai.docsearch.api.dto.response.SearchResponse;
import com.flamingo.ai.docsearch.domain.model.SearchResult;
import com.flamingo.ai.docsearch.service.search.SearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for full-text search and index statistics. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchController {

  private final SearchService searchService;

  /** Searches indexed documents. */
  @PostMapping("/search")
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
    SearchResult result =
        searchService.search(
            request.getQuery(), request.getLimit(), request.getOffset(), request.getFilters());
    return ResponseEntity.ok(SearchResponse.from(result));
  }

  /** Returns index statistics. */
  @GetMapping("/stats")
  public ResponseEntity<IndexStatsResponse> stats() {
    return ResponseEntity.ok(IndexStatsResponse.from(searchService.stats()));
  }
}
