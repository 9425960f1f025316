package com.dev.marketflow.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.dev.marketflow.service.AggregateDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Unit tests for HealthController.
 */
class HealthControllerTest {

  private HealthController healthController;
  private AggregateDataService aggregateDataService;

  /**
   * Set up test fixtures before each test.
   */
  @BeforeEach
  void setUp() {
    aggregateDataService = mock(AggregateDataService.class);
    healthController = new HealthController(aggregateDataService);
  }

  /**
   * Test health endpoint returns OK - typical valid case.
   */
  @Test
  void testHealth_BackingServiceHealthy_TypicalCase() {
    ResponseEntity<String> response = healthController.health();

    assertNotNull(response);
    assertEquals(HttpStatus.OK, response.getStatusCode());
    assertEquals("OK", response.getBody());
    assertEquals(MediaType.TEXT_PLAIN, response.getHeaders().getContentType());
    verify(aggregateDataService).healthCheck();
  }

  /**
   * Test health endpoint with backing service failure - invalid case.
   */
  @Test
  void testHealth_BackingServiceUnhealthy_InvalidCase() {
    doThrow(new IllegalStateException("Aggregate data service unreachable"))
        .when(aggregateDataService).healthCheck();

    ResponseEntity<String> response = healthController.health();

    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
    assertEquals("Service Unavailable", response.getBody());
  }
}
