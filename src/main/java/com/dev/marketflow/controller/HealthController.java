package com.dev.marketflow.controller;

import com.dev.marketflow.service.AggregateDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for the service health check.
 * Healthy means the aggregate data service answers its own health check.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

  private static final Logger log = LoggerFactory.getLogger(HealthController.class);

  private final AggregateDataService aggregateDataService;

  /**
   * Constructor with dependency injection.
   *
   * @param aggregateDataService the backing aggregate data service
   */
  @Autowired
  public HealthController(AggregateDataService aggregateDataService) {
    this.aggregateDataService = aggregateDataService;
  }

  /**
   * Health check endpoint.
   *
   * @return 200 "OK", or 503 "Service Unavailable" when the backing service is unhealthy
   */
  @GetMapping
  public ResponseEntity<String> health() {
    log.info("Health check requested");

    try {
      aggregateDataService.healthCheck();
    } catch (RuntimeException e) {
      log.error("Health check failed", e);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .contentType(MediaType.TEXT_PLAIN)
          .body("Service Unavailable");
    }

    log.info("Health check passed");
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_PLAIN)
        .body("OK");
  }
}
