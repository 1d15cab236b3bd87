package com.flamingo.ai.docsearch.service.health;

import com.flamingo.ai.docsearch.api.dto.response.ConnectionTestResponse;
import com.flamingo.ai.docsearch.api.dto.response.HealthResponse;

/** Service interface for health checks of the backing services. */
public interface HealthService {

  /**
   * Checks the source store and the search index.
   *
   * @return overall status and the status of each backing service
   */
  HealthResponse getHealth();

  /**
   * Tests the connection to the source store.
   *
   * @return whether the store answered, with its product and version
   */
  ConnectionTestResponse testSourceConnection();
}
