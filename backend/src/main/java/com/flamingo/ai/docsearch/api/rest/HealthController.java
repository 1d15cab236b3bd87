package com.flamingo.ai.docsearch.api.rest;

import com.flamingo.ai.docsearch.api.dto.response.ConnectionTestResponse;
import com.flamingo.ai.docsearch.api.dto.response.HealthResponse;
import com.flamingo.ai.docsearch.service.health.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  /** Returns the status of the service and its backing stores. */
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(healthService.getHealth());
  }

  /** Tests the connection to the source store; 503 when it cannot be reached. */
  @GetMapping("/test-connection")
  public ResponseEntity<ConnectionTestResponse> testConnection() {
    ConnectionTestResponse response = healthService.testSourceConnection();
    HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(status).body(response);
  }
}
