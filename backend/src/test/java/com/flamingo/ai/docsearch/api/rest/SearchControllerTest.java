package com.flamingo.ai.docsearch.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.docsearch.domain.model.IndexStats;
import com.flamingo.ai.docsearch.domain.model.SearchResult;
import com.flamingo.ai.docsearch.domain.model.SearchResultHit;
import com.flamingo.ai.docsearch.exception.ApiError;
import com.flamingo.ai.docsearch.exception.GlobalExceptionHandler;
import com.flamingo.ai.docsearch.exception.InvalidFilterException;
import com.flamingo.ai.docsearch.exception.InvalidQueryException;
import com.flamingo.ai.docsearch.exception.SearchIndexUnavailableException;
import com.flamingo.ai.docsearch.service.search.SearchService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchController Tests")
class SearchControllerTest {

  private MockMvc mockMvc;

  @Mock private SearchService searchService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SearchController(searchService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should return shaped hits with formatted fields")
  void shouldReturnShapedHits() throws Exception {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("id", "FORMS_MASTER:1");
    document.put("name", "manual.pdf");
    SearchResultHit hit =
        new SearchResultHit(
            document,
            Map.of("content", "<em>invoice</em> total"),
            List.of("content"),
            2,
            1.5);
    when(searchService.search(eq("invoice"), eq(5), isNull(), isNull()))
        .thenReturn(new SearchResult(List.of(hit), "invoice", 7, 1, 5, 0));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"invoice\",\"limit\":5}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.query").value("invoice"))
        .andExpect(jsonPath("$.processingTimeMs").value(7))
        .andExpect(jsonPath("$.estimatedTotalHits").value(1))
        .andExpect(jsonPath("$.hits[0].id").value("FORMS_MASTER:1"))
        .andExpect(jsonPath("$.hits[0].name").value("manual.pdf"))
        .andExpect(jsonPath("$.hits[0]._formatted.content").value("<em>invoice</em> total"))
        .andExpect(jsonPath("$.hits[0]._matchedFields[0]").value("content"))
        .andExpect(jsonPath("$.hits[0].pageNumber").value(2));
  }

  @Test
  @DisplayName("Should omit page number when no page matched")
  void shouldOmitPageNumberWhenAbsent() throws Exception {
    SearchResultHit hit =
        new SearchResultHit(Map.of("id", "FORMS_MASTER:2"), Map.of(), List.of(), null, 1.0);
    when(searchService.search(any(), any(), any(), any()))
        .thenReturn(new SearchResult(List.of(hit), "x", 1, 1, 20, 0));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"x\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.hits[0].pageNumber").doesNotExist());
  }

  @Test
  @DisplayName("Should return 400 for an empty query")
  void shouldRejectEmptyQuery() throws Exception {
    when(searchService.search(any(), any(), any(), any()))
        .thenThrow(new InvalidQueryException("Query must not be empty"));

    mockMvc
        .perform(
            post("/api/search").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.INVALID_QUERY))
        .andExpect(jsonPath("$.message").value("Query must not be empty"));
  }

  @Test
  @DisplayName("Should return 400 for an unparseable filter")
  void shouldRejectInvalidFilter() throws Exception {
    when(searchService.search(any(), any(), any(), any()))
        .thenThrow(new InvalidFilterException("size:>>", null));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"x\",\"filters\":\"size:>>\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.INVALID_FILTER));
  }

  @Test
  @DisplayName("Should return 400 for a missing body")
  void shouldRejectMissingBody() throws Exception {
    mockMvc
        .perform(post("/api/search").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }

  @Test
  @DisplayName("Should return 400 for an oversized query")
  void shouldRejectOversizedQuery() throws Exception {
    String query = "a".repeat(1001);

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"" + query + "\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }

  @Test
  @DisplayName("Should return 503 when the index is unreachable")
  void shouldReturnServiceUnavailable() throws Exception {
    when(searchService.search(any(), any(), any(), any()))
        .thenThrow(new SearchIndexUnavailableException("Connection refused", null));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"x\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value(ApiError.SEARCH_INDEX_UNAVAILABLE));
  }

  @Test
  @DisplayName("Should return index statistics")
  void shouldReturnStats() throws Exception {
    when(searchService.stats()).thenReturn(new IndexStats(3, true, Map.of("content", 3L)));

    mockMvc
        .perform(get("/api/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.numberOfDocuments").value(3))
        .andExpect(jsonPath("$.isIndexing").value(true))
        .andExpect(jsonPath("$.fieldDistribution.content").value(3));
  }
}
