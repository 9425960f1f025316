package com.dev.marketflow.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * This class defines the MarketData model returned by the aggregate data service.
 */
public class MarketData {

  private String symbol;
  private String exchange;
  private BigDecimal price;
  private Instant timestamp;

  /**
   * Default no-argument constructor. Should not be used directly in application logic.
   */
  public MarketData() {
    // For framework use only
  }

  /**
   * Constructs a new MarketData record.
   *
   * @param symbol trading symbol (e.g., "BTC")
   * @param exchange exchange the price was observed on, canonical address
   *        or short identifier depending on which side of the API it is on
   * @param price the statistic's price value
   * @param timestamp time the price was observed or aggregated
   */
  public MarketData(String symbol, String exchange, BigDecimal price, Instant timestamp) {
    this.symbol = symbol;
    this.exchange = exchange;
    this.price = price;
    this.timestamp = timestamp;
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Returns the exchange this record belongs to. Empty or null when the
   * record aggregates over every exchange.
   *
   * @return the exchange identifier
   */
  public String getExchange() {
    return exchange;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  /**
   * Returns a copy of this record carrying a different exchange value.
   *
   * @param newExchange the exchange value for the copy
   * @return a new MarketData instance
   */
  public MarketData withExchange(String newExchange) {
    return new MarketData(symbol, newExchange, price, timestamp);
  }

  @Override
  public String toString() {
    return String.format("MarketData[%s | exchange=%s, price=%s, ts=%s]",
        symbol, exchange, price, timestamp);
  }
}
