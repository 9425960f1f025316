package com.dev.marketflow.exception;

/**
 * Structured application error reported by the aggregate data service:
 * an HTTP-style status code and a client-safe message.
 */
public class AggregateServiceException extends RuntimeException {

  private final int code;

  /**
   * Constructs an AggregateServiceException.
   *
   * @param code HTTP status code chosen by the aggregate data service
   * @param message the detail message, safe to return to API clients
   * @throws IllegalArgumentException if the code is not a valid HTTP status
   */
  public AggregateServiceException(int code, String message) {
    super(message);
    if (code < 100 || code > 599) {
      throw new IllegalArgumentException("Invalid status code: " + code);
    }
    this.code = code;
  }

  public int getCode() {
    return code;
  }
}
