package com.dev.marketflow.service;

import com.dev.marketflow.exception.ErrorKind;
import com.dev.marketflow.exception.PriceApiException;
import com.dev.marketflow.exchange.ExchangeRegistry;
import com.dev.marketflow.model.AggregateScope;
import com.dev.marketflow.model.PriceQuery;
import com.dev.marketflow.model.PriceStatistic;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * <p><b>Turns a raw price request into a {@link PriceQuery}.</b></p>
 *
 * <p>Path shapes (after trimming leading and trailing slashes):</p>
 * <ul>
 *   <li><code>price/{statistic}/{symbol}</code>: all exchanges.</li>
 *   <li><code>price/{statistic}/{exchange}/{symbol}</code>: one exchange.</li>
 * </ul>
 *
 * <p>Validation runs in a fixed order and stops at the first failure:
 * period applicability (latest only), path shape, exchange, symbol, period
 * value, and finally the statistic's period/exchange combination. Nothing
 * here calls the aggregate data service.</p>
 *
 * <p>Operation selection:</p>
 * <ul>
 *   <li>no period, no exchange: {@link AggregateScope#ALL_EXCHANGES}</li>
 *   <li>no period, exchange: {@link AggregateScope#BY_EXCHANGE}</li>
 *   <li>period: {@link AggregateScope#BY_PERIOD}, with an empty exchange when
 *   none was given. Average refuses a period without an exchange.</li>
 * </ul>
 */
@Component
public class PriceRequestResolver {

  private static final Logger log = LoggerFactory.getLogger(PriceRequestResolver.class);

  static final int MAX_SYMBOL_LENGTH = 10;

  private final ExchangeRegistry exchangeRegistry;

  public PriceRequestResolver(ExchangeRegistry exchangeRegistry) {
    this.exchangeRegistry = exchangeRegistry;
  }

  /**
   * Validates a request and selects the aggregate operation to run.
   *
   * @param statistic the endpoint's statistic
   * @param path the request path, e.g. "/price/highest/exchange1/BTC"
   * @param rawPeriod the <code>period</code> query parameter, null or empty if absent
   * @return the normalized query
   * @throws PriceApiException with a validation {@link ErrorKind} when the
   *         request is rejected
   */
  public PriceQuery resolve(PriceStatistic statistic, String path, String rawPeriod) {
    boolean periodSupplied = rawPeriod != null && !rawPeriod.isEmpty();

    if (periodSupplied && !statistic.acceptsPeriod()) {
      throw reject(ErrorKind.PERIOD_NOT_APPLICABLE,
          "period parameter is not applicable for " + statistic.getPathSegment() + " price");
    }

    String[] parts = splitPath(path);
    String exchangeToken;
    String symbolToken;
    if (parts.length == 3) {
      exchangeToken = "";
      symbolToken = parts[2];
    } else if (parts.length == 4) {
      exchangeToken = parts[2];
      symbolToken = parts[3];
    } else {
      throw reject(ErrorKind.INVALID_PATH, "Invalid path");
    }

    String exchange = resolveExchange(exchangeToken);
    String symbol = normalizeSymbol(symbolToken);
    Duration period = periodSupplied ? parsePeriod(rawPeriod) : null;

    AggregateScope scope;
    if (period != null) {
      if (exchange.isEmpty() && !statistic.allowsPeriodWithoutExchange()) {
        throw reject(ErrorKind.PERIOD_REQUIRES_EXCHANGE,
            "cannot get " + statistic.getPathSegment() + " by period without exchange");
      }
      scope = AggregateScope.BY_PERIOD;
    } else if (exchange.isEmpty()) {
      scope = AggregateScope.ALL_EXCHANGES;
    } else {
      scope = AggregateScope.BY_EXCHANGE;
    }

    return new PriceQuery(statistic, scope, symbol, exchange, period);
  }

  /**
   * Splits a path on "/" after trimming leading and trailing slashes.
   * Empty inner segments are kept, so "a//b" has three segments.
   */
  static String[] splitPath(String path) {
    if (path == null) {
      return new String[] {""};
    }
    int start = 0;
    int end = path.length();
    while (start < end && path.charAt(start) == '/') {
      start++;
    }
    while (end > start && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(start, end).split("/", -1);
  }

  /**
   * Validates a symbol and returns it upper-cased.
   *
   * @param symbol the raw symbol token
   * @return the upper-case symbol
   * @throws PriceApiException of kind {@link ErrorKind#INVALID_SYMBOL}
   */
  public static String normalizeSymbol(String symbol) {
    if (symbol == null || symbol.isEmpty()) {
      throw reject(ErrorKind.INVALID_SYMBOL, "symbol is required");
    }
    if (symbol.length() > MAX_SYMBOL_LENGTH) {
      throw reject(ErrorKind.INVALID_SYMBOL, "symbol is too long");
    }
    for (int i = 0; i < symbol.length(); i++) {
      char c = symbol.charAt(i);
      boolean alphanumeric = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')
          || (c >= '0' && c <= '9');
      if (!alphanumeric) {
        throw reject(ErrorKind.INVALID_SYMBOL, "symbol must be alphanumeric");
      }
    }
    return symbol.toUpperCase(Locale.ROOT);
  }

  /**
   * Maps an exchange token to its canonical address. An empty token stands
   * for all exchanges and maps to "".
   *
   * @param token the short exchange identifier, any case
   * @return the canonical address, or "" for all exchanges
   * @throws PriceApiException of kind {@link ErrorKind#UNKNOWN_EXCHANGE}
   */
  public String resolveExchange(String token) {
    if (token == null || token.isEmpty()) {
      return "";
    }
    return exchangeRegistry.resolveAddress(token)
        .orElseThrow(() -> reject(ErrorKind.UNKNOWN_EXCHANGE, "unknown exchange"));
  }

  /**
   * Parses a non-empty period parameter and requires it to be positive.
   *
   * @param raw the period expression, e.g. "5m"
   * @return the positive period
   * @throws PriceApiException of kind {@link ErrorKind#INVALID_PERIOD_FORMAT}
   *         or {@link ErrorKind#INVALID_PERIOD}
   */
  public static Duration parsePeriod(String raw) {
    Duration period;
    try {
      period = PeriodParser.parse(raw);
    } catch (IllegalArgumentException e) {
      log.debug("Rejected period '{}': {}", raw, e.getMessage());
      throw reject(ErrorKind.INVALID_PERIOD_FORMAT, "invalid period format");
    }
    if (period.isNegative() || period.isZero()) {
      throw reject(ErrorKind.INVALID_PERIOD, "period must be positive");
    }
    return period;
  }

  private static PriceApiException reject(ErrorKind kind, String message) {
    return PriceApiException.validation(kind, message);
  }
}
