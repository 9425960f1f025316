package com.dev.marketflow.service;

import com.dev.marketflow.exception.AggregateServiceException;
import com.dev.marketflow.model.MarketData;
import com.dev.marketflow.model.Mode;
import com.dev.marketflow.model.PriceStatistic;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * <p><b>HTTP adapter for the aggregate data service</b>.</p>
 *
 * <p><b>Endpoints called:</b></p>
 * <ul>
 *   <li><code>GET {base}/aggregates/{statistic}?symbol=S[&amp;exchange=E][&amp;period=P]</code>,
 *   where the period is an ISO-8601 duration (e.g. <code>PT5M</code>). The
 *   operation variant is implied by which parameters are present.</li>
 *   <li><code>GET {base}/health</code></li>
 *   <li><code>POST {base}/mode/{test|live}</code>, sent asynchronously.</li>
 * </ul>
 *
 * <p><b>Error mapping:</b></p>
 * <ul>
 *   <li>Non-2xx answers become an {@link AggregateServiceException} carrying the
 *   answer's status and the <code>error</code> field of its JSON body.</li>
 *   <li>Transport failures and timeouts become an {@link IllegalStateException}.</li>
 * </ul>
 *
 * <p><b>Configuration:</b> <code>marketflow.aggregator.base-url</code> and
 * <code>marketflow.aggregator.timeout</code> in <code>application.properties</code>.</p>
 */
@Service
public class RemoteAggregateService implements AggregateDataService {

  private static final Logger log = LoggerFactory.getLogger(RemoteAggregateService.class);

  private final ObjectMapper mapper;
  private final HttpClient client;
  private final String baseUrl;
  private final Duration timeout;

  /**
   * Constructs the RemoteAggregateService.
   *
   * @param mapper Spring's ObjectMapper, with JavaTimeModule registered
   * @param client the HTTP client bean
   * @param baseUrl base URL of the aggregate data service
   * @param timeout per-request timeout
   */
  @Autowired
  public RemoteAggregateService(ObjectMapper mapper,
                                HttpClient client,
                                @Value("${marketflow.aggregator.base-url}") String baseUrl,
                                @Value("${marketflow.aggregator.timeout:5s}") Duration timeout) {
    this.mapper = mapper;
    this.client = client;
    this.baseUrl = stripTrailingSlash(baseUrl);
    this.timeout = timeout;
  }

  @Override
  public MarketData getLatestAggregate(String symbol) {
    return fetch(PriceStatistic.LATEST, symbol, "", null);
  }

  @Override
  public MarketData getLatestByExchange(String exchange, String symbol) {
    return fetch(PriceStatistic.LATEST, symbol, exchange, null);
  }

  @Override
  public MarketData getHighestAggregate(String symbol) {
    return fetch(PriceStatistic.HIGHEST, symbol, "", null);
  }

  @Override
  public MarketData getHighestByExchange(String exchange, String symbol) {
    return fetch(PriceStatistic.HIGHEST, symbol, exchange, null);
  }

  @Override
  public MarketData getHighestByPeriod(String exchange, String symbol, Duration period) {
    return fetch(PriceStatistic.HIGHEST, symbol, exchange, period);
  }

  @Override
  public MarketData getLowestAggregate(String symbol) {
    return fetch(PriceStatistic.LOWEST, symbol, "", null);
  }

  @Override
  public MarketData getLowestByExchange(String exchange, String symbol) {
    return fetch(PriceStatistic.LOWEST, symbol, exchange, null);
  }

  @Override
  public MarketData getLowestByPeriod(String exchange, String symbol, Duration period) {
    return fetch(PriceStatistic.LOWEST, symbol, exchange, period);
  }

  @Override
  public MarketData getAverageAggregate(String symbol) {
    return fetch(PriceStatistic.AVERAGE, symbol, "", null);
  }

  @Override
  public MarketData getAverageByExchange(String exchange, String symbol) {
    return fetch(PriceStatistic.AVERAGE, symbol, exchange, null);
  }

  @Override
  public MarketData getAverageByPeriod(String exchange, String symbol, Duration period) {
    return fetch(PriceStatistic.AVERAGE, symbol, exchange, period);
  }

  @Override
  public void healthCheck() {
    HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/health"))
        .timeout(timeout)
        .GET()
        .build();
    HttpResponse<String> response = send(request);
    if (!isSuccess(response.statusCode())) {
      throw new IllegalStateException(
          "Aggregate data service health check returned status " + response.statusCode());
    }
  }

  @Override
  public void setMode(Mode mode) {
    HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/mode/" + mode.wireName()))
        .timeout(timeout)
        .POST(HttpRequest.BodyPublishers.noBody())
        .build();

    client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .whenComplete((response, error) -> {
          if (error != null) {
            log.error("Failed to switch aggregate data service to {} mode", mode, error);
          } else if (!isSuccess(response.statusCode())) {
            log.warn("Aggregate data service refused {} mode: status={}",
                mode, response.statusCode());
          } else {
            log.info("Aggregate data service switched to {} mode", mode);
          }
        });
  }

  /**
   * Builds the aggregate request URI. Empty exchange and null period are
   * left out of the query string.
   */
  URI aggregateUri(PriceStatistic statistic, String symbol, String exchange, Duration period) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("symbol", symbol);
    if (exchange != null && !exchange.isEmpty()) {
      params.put("exchange", exchange);
    }
    if (period != null) {
      params.put("period", period.toString());
    }

    StringBuilder uri = new StringBuilder(baseUrl)
        .append("/aggregates/")
        .append(statistic.getPathSegment());
    char separator = '?';
    for (Map.Entry<String, String> param : params.entrySet()) {
      uri.append(separator)
          .append(param.getKey())
          .append('=')
          .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
      separator = '&';
    }
    return URI.create(uri.toString());
  }

  private MarketData fetch(PriceStatistic statistic, String symbol, String exchange,
                           Duration period) {
    HttpRequest request = HttpRequest.newBuilder(aggregateUri(statistic, symbol, exchange, period))
        .timeout(timeout)
        .header("Accept", "application/json")
        .GET()
        .build();

    HttpResponse<String> response = send(request);
    int status = response.statusCode();
    if (!isSuccess(status)) {
      throw new AggregateServiceException(status, errorMessage(status, response.body()));
    }

    try {
      return mapper.readValue(response.body(), MarketData.class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Malformed aggregate response from " + request.uri(), e);
    }
  }

  private HttpResponse<String> send(HttpRequest request) {
    try {
      return client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new IllegalStateException("Aggregate data service unreachable: " + request.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted calling " + request.uri(), e);
    }
  }

  /**
   * Extracts the <code>error</code> field of an error body, falling back to a
   * status-based message when the body carries none.
   */
  String errorMessage(int status, String body) {
    String fallback = "aggregate service returned status " + status;
    if (body == null || body.isBlank()) {
      return fallback;
    }
    try {
      JsonNode error = mapper.readTree(body).path("error");
      return error.isTextual() && !error.asText().isBlank() ? error.asText() : fallback;
    } catch (JsonProcessingException e) {
      log.debug("Non-JSON error body from aggregate data service (status {})", status);
      return fallback;
    }
  }

  private static boolean isSuccess(int status) {
    return status >= 200 && status < 300;
  }

  private static String stripTrailingSlash(String url) {
    String trimmed = url.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }
}
