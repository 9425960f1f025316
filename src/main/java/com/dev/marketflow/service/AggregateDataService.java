package com.dev.marketflow.service;

import com.dev.marketflow.model.MarketData;
import com.dev.marketflow.model.Mode;
import java.time.Duration;

/**
 * <p>Contract of the aggregate data service that computes price statistics.</p>
 *
 * <p>Exchanges are passed as canonical addresses (e.g. <code>exchange1:40101</code>);
 * an empty exchange on the period operations means all exchanges. Read
 * operations either return a record or throw: an
 * {@link com.dev.marketflow.exception.AggregateServiceException} for errors the
 * service classified itself, any other runtime exception otherwise.</p>
 */
public interface AggregateDataService {

  MarketData getLatestAggregate(String symbol);

  MarketData getLatestByExchange(String exchange, String symbol);

  MarketData getHighestAggregate(String symbol);

  MarketData getHighestByExchange(String exchange, String symbol);

  MarketData getHighestByPeriod(String exchange, String symbol, Duration period);

  MarketData getLowestAggregate(String symbol);

  MarketData getLowestByExchange(String exchange, String symbol);

  MarketData getLowestByPeriod(String exchange, String symbol, Duration period);

  MarketData getAverageAggregate(String symbol);

  MarketData getAverageByExchange(String exchange, String symbol);

  MarketData getAverageByPeriod(String exchange, String symbol, Duration period);

  /**
   * Checks that the service is reachable and healthy.
   *
   * @throws RuntimeException if it is not
   */
  void healthCheck();

  /**
   * Switches the service's data source. Returns once the request is
   * handed off; completion is not reported.
   *
   * @param mode the data source to use
   */
  void setMode(Mode mode);
}
