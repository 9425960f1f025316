package com.dev.marketflow.config;

import com.dev.marketflow.exchange.ExchangeRegistry;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-wide beans shared by the price endpoints.
 */
@Configuration
public class MarketFlowConfig {

  private static final Logger log = LoggerFactory.getLogger(MarketFlowConfig.class);

  /**
   * Builds the exchange registry once at startup. Falls back to the default
   * deployment's exchanges when none are configured.
   *
   * @param properties bound exchange configuration
   * @return the immutable registry injected into the resolver and query service
   */
  @Bean
  public ExchangeRegistry exchangeRegistry(ExchangeProperties properties) {
    ExchangeRegistry registry = properties.getAddresses().isEmpty()
        ? ExchangeRegistry.defaults()
        : new ExchangeRegistry(properties.getAddresses());
    log.info("Loaded {} exchange mappings: {}", registry.size(), registry.shortIds());
    return registry;
  }

  /**
   * HTTP client used to reach the aggregate data service.
   */
  @Bean
  public HttpClient aggregatorHttpClient(
      @Value("${marketflow.aggregator.timeout:5s}") Duration timeout) {
    return HttpClient.newBuilder()
        .connectTimeout(timeout)
        .build();
  }
}
