package com.flamingo.ai.docsearch.service.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docsearch.api.dto.response.ConnectionTestResponse;
import com.flamingo.ai.docsearch.api.dto.response.HealthResponse;
import com.flamingo.ai.docsearch.domain.model.IndexStats;
import com.flamingo.ai.docsearch.elasticsearch.SearchIndexClient;
import com.flamingo.ai.docsearch.exception.SearchIndexUnavailableException;
import com.flamingo.ai.docsearch.exception.SourceStoreUnavailableException;
import com.flamingo.ai.docsearch.service.indexing.IndexingPipeline;
import com.flamingo.ai.docsearch.source.SourceStoreGateway;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HealthServiceImplTest {

  @Mock private SourceStoreGateway sourceStore;

  @Mock private SearchIndexClient searchIndex;

  @Mock private IndexingPipeline indexingPipeline;

  private HealthServiceImpl healthService;

  @BeforeEach
  void setUp() {
    healthService = new HealthServiceImpl(sourceStore, searchIndex, indexingPipeline);
    when(sourceStore.testConnection()).thenReturn("Microsoft SQL Server 16.00");
    when(searchIndex.stats()).thenReturn(new IndexStats(42, false, Map.of()));
  }

  @Test
  void shouldReportUp_whenBothStoresRespond() {
    HealthResponse health = healthService.getHealth();

    assertThat(health.getStatus()).isEqualTo("UP");
    assertThat(health.getSourceStore()).isEqualTo("UP");
    assertThat(health.getSearchIndex()).isEqualTo("UP");
    assertThat(health.getDocumentsIndexed()).isEqualTo(42L);
    assertThat(health.getTimestamp()).isNotNull();
  }

  @Test
  void shouldReportDegraded_whenIndexIsDown() {
    when(searchIndex.stats())
        .thenThrow(new SearchIndexUnavailableException("Connection refused", null));

    HealthResponse health = healthService.getHealth();

    assertThat(health.getStatus()).isEqualTo("DEGRADED");
    assertThat(health.getSearchIndex()).isEqualTo("DOWN");
    assertThat(health.getDocumentsIndexed()).isNull();
  }

  @Test
  void shouldReportDegraded_whenSourceStoreIsDown() {
    when(sourceStore.testConnection())
        .thenThrow(new SourceStoreUnavailableException("Login failed", null));
    when(indexingPipeline.isRunning()).thenReturn(true);

    HealthResponse health = healthService.getHealth();

    assertThat(health.getStatus()).isEqualTo("DEGRADED");
    assertThat(health.getSourceStore()).isEqualTo("DOWN");
    assertThat(health.isIndexingRunning()).isTrue();
  }

  @Test
  void shouldReportDatabase_whenConnectionSucceeds() {
    ConnectionTestResponse response = healthService.testSourceConnection();

    assertThat(response.isSuccess()).isTrue();
    assertThat(response.getDatabase()).isEqualTo("Microsoft SQL Server 16.00");
  }

  @Test
  void shouldReportFailure_whenConnectionFails() {
    when(sourceStore.testConnection())
        .thenThrow(new SourceStoreUnavailableException("Login failed for user 'sa'", null));

    ConnectionTestResponse response = healthService.testSourceConnection();

    assertThat(response.isSuccess()).isFalse();
    assertThat(response.getMessage()).startsWith("Connection failed");
    assertThat(response.getDatabase()).isNull();
  }
}
