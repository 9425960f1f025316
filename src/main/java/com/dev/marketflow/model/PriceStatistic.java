package com.dev.marketflow.model;

import java.util.Optional;

/**
 * Price statistics served under <code>/price/{statistic}</code>, each with
 * the period capabilities of its endpoint.
 */
public enum PriceStatistic {

  LATEST("latest", false, false),
  HIGHEST("highest", true, true),
  LOWEST("lowest", true, true),
  AVERAGE("average", true, false);

  private final String pathSegment;
  private final boolean acceptsPeriod;
  private final boolean periodWithoutExchange;

  PriceStatistic(String pathSegment, boolean acceptsPeriod, boolean periodWithoutExchange) {
    this.pathSegment = pathSegment;
    this.acceptsPeriod = acceptsPeriod;
    this.periodWithoutExchange = periodWithoutExchange;
  }

  public String getPathSegment() {
    return pathSegment;
  }

  /**
   * Whether the endpoint takes a <code>period</code> query parameter at all.
   */
  public boolean acceptsPeriod() {
    return acceptsPeriod;
  }

  /**
   * Whether a period may be combined with "all exchanges". Average over a
   * period is only served per exchange.
   */
  public boolean allowsPeriodWithoutExchange() {
    return periodWithoutExchange;
  }

  /**
   * Looks up a statistic by its path segment (e.g. "highest"). Matching is
   * case-sensitive, like the routes themselves.
   */
  public static Optional<PriceStatistic> fromPathSegment(String segment) {
    if (segment == null) {
      return Optional.empty();
    }
    for (PriceStatistic statistic : values()) {
      if (statistic.pathSegment.equals(segment)) {
        return Optional.of(statistic);
      }
    }
    return Optional.empty();
  }
}
