package com.dev.marketflow.controller;

import com.dev.marketflow.model.Mode;
import com.dev.marketflow.service.AggregateDataService;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Switches the aggregate data service between test and live data, then
 * redirects back to the index page.
 *
 * <p>Base path: <code>/mode</code></p>
 */
@RestController
@RequestMapping("/mode")
public class ModeController {

  private static final Logger log = LoggerFactory.getLogger(ModeController.class);

  private final AggregateDataService aggregateDataService;

  public ModeController(AggregateDataService aggregateDataService) {
    this.aggregateDataService = aggregateDataService;
  }

  /**
   * GET|POST /mode/test
   */
  @RequestMapping(value = "/test", method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<Void> testMode() {
    return switchTo(Mode.TEST);
  }

  /**
   * GET|POST /mode/live
   */
  @RequestMapping(value = "/live", method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<Void> liveMode() {
    return switchTo(Mode.LIVE);
  }

  private ResponseEntity<Void> switchTo(Mode mode) {
    log.info("Switching to {} mode", mode);
    aggregateDataService.setMode(mode);
    return ResponseEntity.status(HttpStatus.SEE_OTHER)
        .location(URI.create("/"))
        .build();
  }
}
