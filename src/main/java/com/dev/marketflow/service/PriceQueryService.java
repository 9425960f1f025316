package com.dev.marketflow.service;

import com.dev.marketflow.exception.AggregateServiceException;
import com.dev.marketflow.exception.PriceApiException;
import com.dev.marketflow.exchange.ExchangeRegistry;
import com.dev.marketflow.model.MarketData;
import com.dev.marketflow.model.PriceQuery;
import com.dev.marketflow.model.PriceStatistic;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * <p>Runs a resolved {@link PriceQuery} against the {@link AggregateDataService}.</p>
 *
 * <p>On success the record's canonical exchange address is replaced by its
 * short identifier when the registry knows it. On failure the error is
 * classified exactly once:</p>
 * <ul>
 *   <li>{@link AggregateServiceException}: surfaced with its own status and message.</li>
 *   <li>anything else: logged in full, surfaced as a generic 500.</li>
 * </ul>
 *
 * <p>Failed calls are not retried.</p>
 */
@Service
public class PriceQueryService {

  private static final Logger log = LoggerFactory.getLogger(PriceQueryService.class);

  private final AggregateDataService aggregateDataService;
  private final ExchangeRegistry exchangeRegistry;

  public PriceQueryService(AggregateDataService aggregateDataService,
                           ExchangeRegistry exchangeRegistry) {
    this.aggregateDataService = aggregateDataService;
    this.exchangeRegistry = exchangeRegistry;
  }

  /**
   * Executes the query.
   *
   * @param query a validated query
   * @return the record, with its exchange rewritten to the short identifier when mapped
   * @throws PriceApiException of kind DOMAIN or INTERNAL when the backing call fails
   */
  public MarketData execute(PriceQuery query) {
    MarketData data;
    try {
      data = dispatch(query);
    } catch (AggregateServiceException e) {
      log.warn("{} price error: symbol={} exchange={} status={} error={}",
          query.getStatistic(), query.getSymbol(), query.getExchange(), e.getCode(),
          e.getMessage());
      throw PriceApiException.domain(e);
    } catch (RuntimeException e) {
      log.error("Unexpected error: statistic={} symbol={} exchange={}",
          query.getStatistic(), query.getSymbol(), query.getExchange(), e);
      throw PriceApiException.internal(e);
    }

    if (data == null) {
      log.error("Aggregate data service returned no record for {}", query);
      throw PriceApiException.internal(
          new IllegalStateException("Empty aggregate result for " + query));
    }

    return data.withExchange(exchangeRegistry.toShortId(data.getExchange()));
  }

  private MarketData dispatch(PriceQuery query) {
    PriceStatistic statistic = query.getStatistic();
    String symbol = query.getSymbol();
    String exchange = query.getExchange();
    Duration period = query.getPeriod().orElse(null);

    switch (query.getScope()) {
      case ALL_EXCHANGES:
        return aggregateOf(statistic, symbol);
      case BY_EXCHANGE:
        return byExchange(statistic, exchange, symbol);
      case BY_PERIOD:
        return byPeriod(statistic, exchange, symbol, period);
      default:
        throw new IllegalStateException("Unhandled scope " + query.getScope());
    }
  }

  private MarketData aggregateOf(PriceStatistic statistic, String symbol) {
    switch (statistic) {
      case LATEST:
        return aggregateDataService.getLatestAggregate(symbol);
      case HIGHEST:
        return aggregateDataService.getHighestAggregate(symbol);
      case LOWEST:
        return aggregateDataService.getLowestAggregate(symbol);
      case AVERAGE:
        return aggregateDataService.getAverageAggregate(symbol);
      default:
        throw new IllegalStateException("Unhandled statistic " + statistic);
    }
  }

  private MarketData byExchange(PriceStatistic statistic, String exchange, String symbol) {
    switch (statistic) {
      case LATEST:
        return aggregateDataService.getLatestByExchange(exchange, symbol);
      case HIGHEST:
        return aggregateDataService.getHighestByExchange(exchange, symbol);
      case LOWEST:
        return aggregateDataService.getLowestByExchange(exchange, symbol);
      case AVERAGE:
        return aggregateDataService.getAverageByExchange(exchange, symbol);
      default:
        throw new IllegalStateException("Unhandled statistic " + statistic);
    }
  }

  private MarketData byPeriod(PriceStatistic statistic, String exchange, String symbol,
                              Duration period) {
    switch (statistic) {
      case HIGHEST:
        return aggregateDataService.getHighestByPeriod(exchange, symbol, period);
      case LOWEST:
        return aggregateDataService.getLowestByPeriod(exchange, symbol, period);
      case AVERAGE:
        return aggregateDataService.getAverageByPeriod(exchange, symbol, period);
      default:
        throw new IllegalStateException(statistic + " has no period variant");
    }
  }
}
