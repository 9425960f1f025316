package com.dev.marketflow.exception;

import org.springframework.http.HttpStatusCode;

/**
 * Thrown when a price request cannot be served. Carries the error kind,
 * the HTTP status to answer with, and the message returned to the client.
 */
public class PriceApiException extends RuntimeException {

  public static final String INTERNAL_MESSAGE = "Internal server error";

  private final ErrorKind kind;
  private final HttpStatusCode status;

  /**
   * Constructs a PriceApiException with an explicit status.
   *
   * @param kind the error classification
   * @param status the HTTP status returned to the client
   * @param message the client-facing message
   * @param cause the underlying cause, may be null
   */
  public PriceApiException(ErrorKind kind, HttpStatusCode status, String message,
                           Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.status = status;
  }

  /**
   * Validation failure answered with the kind's default status (400).
   *
   * @param kind a validation error kind
   * @param message the client-facing message
   * @return the exception to throw
   * @throws IllegalArgumentException if kind is not a validation kind
   */
  public static PriceApiException validation(ErrorKind kind, String message) {
    if (!kind.isValidationError()) {
      throw new IllegalArgumentException(kind + " is not a validation error");
    }
    return new PriceApiException(kind, kind.getDefaultStatus(), message, null);
  }

  /**
   * Structured error from the aggregate data service, surfaced verbatim.
   *
   * @param cause the service's error carrying status code and message
   * @return the exception to throw
   */
  public static PriceApiException domain(AggregateServiceException cause) {
    return new PriceApiException(ErrorKind.DOMAIN, HttpStatusCode.valueOf(cause.getCode()),
        cause.getMessage(), cause);
  }

  /**
   * Unclassified failure. The cause is kept for logging only; the message
   * is generic.
   *
   * @param cause the underlying failure
   * @return the exception to throw
   */
  public static PriceApiException internal(Throwable cause) {
    return new PriceApiException(ErrorKind.INTERNAL, ErrorKind.INTERNAL.getDefaultStatus(),
        INTERNAL_MESSAGE, cause);
  }

  public ErrorKind getKind() {
    return kind;
  }

  public HttpStatusCode getStatus() {
    return status;
  }
}
