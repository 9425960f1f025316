package com.dev.marketflow.exception;

import org.springframework.http.HttpStatus;

/**
 * Classification of every failure a price request can end in.
 */
public enum ErrorKind {
  INVALID_PATH(HttpStatus.BAD_REQUEST),
  INVALID_SYMBOL(HttpStatus.BAD_REQUEST),
  UNKNOWN_EXCHANGE(HttpStatus.BAD_REQUEST),
  PERIOD_NOT_APPLICABLE(HttpStatus.BAD_REQUEST),
  INVALID_PERIOD_FORMAT(HttpStatus.BAD_REQUEST),
  INVALID_PERIOD(HttpStatus.BAD_REQUEST),
  PERIOD_REQUIRES_EXCHANGE(HttpStatus.BAD_REQUEST),
  /** Structured error reported by the aggregate data service. Has no status of its own. */
  DOMAIN(null),
  INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus defaultStatus;

  ErrorKind(HttpStatus defaultStatus) {
    this.defaultStatus = defaultStatus;
  }

  /**
   * Status answered for this kind, or null for {@link #DOMAIN}, whose status
   * always comes from the aggregate data service's error.
   */
  public HttpStatus getDefaultStatus() {
    return defaultStatus;
  }

  /**
   * True for the kinds raised while validating a request, before any
   * backing call is made.
   */
  public boolean isValidationError() {
    return this != DOMAIN && this != INTERNAL;
  }
}
