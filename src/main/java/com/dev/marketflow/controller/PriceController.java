package com.dev.marketflow.controller;

import com.dev.marketflow.model.MarketData;
import com.dev.marketflow.model.PriceQuery;
import com.dev.marketflow.model.PriceStatistic;
import com.dev.marketflow.service.PriceQueryService;
import com.dev.marketflow.service.PriceRequestResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.util.UrlPathHelper;

/**
 * <p>REST controller that exposes the price statistic endpoints.</p>
 *
 * <ul>
 *   <li><code>GET /price/latest/[{exchange}/]{symbol}</code></li>
 *   <li><code>GET /price/highest/[{exchange}/]{symbol}[?period=D]</code></li>
 *   <li><code>GET /price/lowest/[{exchange}/]{symbol}[?period=D]</code></li>
 *   <li><code>GET /price/average/[{exchange}/]{symbol}[?period=D]</code></li>
 * </ul>
 *
 * <p>Every path under a statistic is routed here so that the
 * {@link PriceRequestResolver} can reject malformed shapes with a 400
 * instead of the router answering 404.</p>
 *
 * <p>Base path: <code>/price</code></p>
 */
@RestController
@RequestMapping("/price")
public class PriceController {

  private static final Logger log = LoggerFactory.getLogger(PriceController.class);

  /** Decodes the path but keeps ";" content so it reaches symbol validation. */
  private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

  static {
    PATH_HELPER.setRemoveSemicolonContent(false);
  }

  private final PriceRequestResolver resolver;
  private final PriceQueryService priceQueryService;

  public PriceController(PriceRequestResolver resolver, PriceQueryService priceQueryService) {
    this.resolver = resolver;
    this.priceQueryService = priceQueryService;
  }

  /**
   * GET /price/{statistic}/**
   * Returns the requested statistic for a symbol, optionally scoped to an
   * exchange and a period.
   */
  @GetMapping("/{statistic}/**")
  public ResponseEntity<MarketData> getPrice(@PathVariable String statistic,
                                             HttpServletRequest request) {
    PriceStatistic priceStatistic = PriceStatistic.fromPathSegment(statistic)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
            "Unknown price statistic: " + statistic));

    String path = PATH_HELPER.getPathWithinApplication(request);
    // first value only when the parameter is repeated
    String period = request.getParameter("period");
    PriceQuery query = resolver.resolve(priceStatistic, path, period);
    log.debug("Resolved {} to {}", path, query);

    return ResponseEntity.ok(priceQueryService.execute(query));
  }
}
