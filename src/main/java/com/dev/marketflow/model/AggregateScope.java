package com.dev.marketflow.model;

/**
 * Which variant of an aggregate operation a query resolves to.
 */
public enum AggregateScope {
  /** Aggregate across all exchanges, no period. */
  ALL_EXCHANGES,
  /** Single exchange, no period. */
  BY_EXCHANGE,
  /** Bounded by a period; the exchange may be empty for all exchanges. */
  BY_PERIOD
}
