package com.dev.marketflow.service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;

/**
 * <p>Parses period expressions such as <code>5m</code>, <code>1h30m</code>,
 * <code>1.5h</code> or <code>300ms</code> into a {@link Duration}.</p>
 *
 * <p>Grammar: an optional sign followed by one or more
 * <code>number unit</code> pairs, where the number may carry a decimal
 * fraction and the unit is one of <code>ns, us, µs, μs, ms, s, m, h</code>.
 * The bare literal <code>0</code> is also accepted. Sign handling is left to
 * the caller: negative and zero results are returned as-is.</p>
 */
public final class PeriodParser {

  private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
      "ns", 1L,
      "us", 1_000L,
      "µs", 1_000L,
      "μs", 1_000L,
      "ms", 1_000_000L,
      "s", 1_000_000_000L,
      "m", 60_000_000_000L,
      "h", 3_600_000_000_000L);

  private static final BigInteger MAX_NANOS = BigInteger.valueOf(Long.MAX_VALUE);
  private static final BigInteger MIN_NANOS = BigInteger.valueOf(Long.MIN_VALUE);

  private PeriodParser() {
  }

  /**
   * Parses a period expression.
   *
   * @param raw the expression, e.g. "1h30m"
   * @return the parsed duration, possibly zero or negative
   * @throws IllegalArgumentException if the expression is malformed or overflows
   */
  public static Duration parse(String raw) {
    if (raw == null || raw.isEmpty()) {
      throw new IllegalArgumentException("empty period");
    }

    String s = raw;
    boolean negative = false;
    char first = s.charAt(0);
    if (first == '-' || first == '+') {
      negative = first == '-';
      s = s.substring(1);
    }

    if ("0".equals(s)) {
      return Duration.ZERO;
    }
    if (s.isEmpty()) {
      throw new IllegalArgumentException("invalid period " + raw);
    }

    BigDecimal totalNanos = BigDecimal.ZERO;
    int i = 0;
    while (i < s.length()) {
      int numberStart = i;
      while (i < s.length() && (isAsciiDigit(s.charAt(i)) || s.charAt(i) == '.')) {
        i++;
      }
      String number = s.substring(numberStart, i);
      if (number.isEmpty() || ".".equals(number) || number.indexOf('.') != number.lastIndexOf('.')) {
        throw new IllegalArgumentException("invalid period " + raw);
      }

      int unitStart = i;
      while (i < s.length() && s.charAt(i) != '.' && !isAsciiDigit(s.charAt(i))) {
        i++;
      }
      String unit = s.substring(unitStart, i);
      Long nanosPerUnit = NANOS_PER_UNIT.get(unit);
      if (nanosPerUnit == null) {
        throw new IllegalArgumentException(
            unit.isEmpty() ? "missing unit in period " + raw : "unknown unit " + unit);
      }

      totalNanos = totalNanos.add(new BigDecimal(number).multiply(BigDecimal.valueOf(nanosPerUnit)));
    }

    BigInteger nanos = totalNanos.toBigInteger();
    if (negative) {
      nanos = nanos.negate();
    }
    if (nanos.compareTo(MAX_NANOS) > 0 || nanos.compareTo(MIN_NANOS) < 0) {
      throw new IllegalArgumentException("period out of range " + raw);
    }
    return Duration.ofNanos(nanos.longValueExact());
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
