package com.dev.marketflow.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A validated, normalized price request: which statistic, which operation
 * variant, and the arguments to call it with. Built per request by
 * {@link com.dev.marketflow.service.PriceRequestResolver} and consumed
 * immediately by {@link com.dev.marketflow.service.PriceQueryService}.
 */
public final class PriceQuery {

  private final PriceStatistic statistic;
  private final AggregateScope scope;
  private final String symbol;
  private final String exchange;
  private final Duration period;

  /**
   * Creates a query.
   *
   * @param statistic the requested statistic
   * @param scope the selected operation variant
   * @param symbol upper-case symbol
   * @param exchange canonical exchange address, or "" for all exchanges
   * @param period positive period, or null when none was requested
   */
  public PriceQuery(PriceStatistic statistic, AggregateScope scope, String symbol,
                    String exchange, Duration period) {
    this.statistic = Objects.requireNonNull(statistic, "statistic");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.symbol = Objects.requireNonNull(symbol, "symbol");
    this.exchange = exchange == null ? "" : exchange;
    this.period = period;
  }

  public PriceStatistic getStatistic() {
    return statistic;
  }

  public AggregateScope getScope() {
    return scope;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getExchange() {
    return exchange;
  }

  public Optional<Duration> getPeriod() {
    return Optional.ofNullable(period);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PriceQuery)) {
      return false;
    }
    PriceQuery that = (PriceQuery) o;
    return statistic == that.statistic
        && scope == that.scope
        && symbol.equals(that.symbol)
        && exchange.equals(that.exchange)
        && Objects.equals(period, that.period);
  }

  @Override
  public int hashCode() {
    return Objects.hash(statistic, scope, symbol, exchange, period);
  }

  @Override
  public String toString() {
    return String.format("PriceQuery[%s %s | symbol=%s, exchange=%s, period=%s]",
        statistic, scope, symbol, exchange, period);
  }
}
