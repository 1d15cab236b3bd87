package com.flamingo.ai.docsearch.service.health;

import com.flamingo.ai.docsearch.api.dto.response.ConnectionTestResponse;
import com.flamingo.ai.docsearch.api.dto.response.HealthResponse;
import com.flamingo.ai.docsearch.elasticsearch.SearchIndexClient;
import com.flamingo.ai.docsearch.exception.ConnectivityException;
import com.flamingo.ai.docsearch.exception.SearchIndexException;
import com.flamingo.ai.docsearch.service.indexing.IndexingPipeline;
import com.flamingo.ai.docsearch.source.SourceStoreGateway;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of HealthService probing the source store and the search index. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  static final String UP = "UP";
  static final String DOWN = "DOWN";

  private final SourceStoreGateway sourceStore;
  private final SearchIndexClient searchIndex;
  private final IndexingPipeline indexingPipeline;

  @Override
  @Timed(value = "health.check", description = "Time to check backing services")
  public HealthResponse getHealth() {
    String sourceStatus = UP;
    try {
      sourceStore.testConnection();
    } catch (ConnectivityException e) {
      log.warn("Health check: source store down: {}", e.getMessage());
      sourceStatus = DOWN;
    }

    String indexStatus = UP;
    Long indexed = null;
    try {
      indexed = searchIndex.stats().count();
    } catch (ConnectivityException | SearchIndexException e) {
      log.warn("Health check: search index down: {}", e.getMessage());
      indexStatus = DOWN;
    }

    boolean allUp = UP.equals(sourceStatus) && UP.equals(indexStatus);
    return HealthResponse.builder()
        .status(allUp ? UP : "DEGRADED")
        .sourceStore(sourceStatus)
        .searchIndex(indexStatus)
        .documentsIndexed(indexed)
        .indexingRunning(indexingPipeline.isRunning())
        .timestamp(LocalDateTime.now())
        .build();
  }

  @Override
  public ConnectionTestResponse testSourceConnection() {
    try {
      String database = sourceStore.testConnection();
      return ConnectionTestResponse.builder()
          .success(true)
          .message("Connection successful")
          .database(database)
          .build();
    } catch (ConnectivityException e) {
      log.warn("Source store connection test failed: {}", e.getMessage());
      return ConnectionTestResponse.builder()
          .success(false)
          .message("Connection failed: " + e.getUserMessage())
          .build();
    }
  }
}
