package com.dev.marketflow.controller;

import com.dev.marketflow.dto.ApiErrorResponse;
import com.dev.marketflow.exception.PriceApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Centralized exception handling for REST controllers.
 *
 * <p>Maps {@link PriceApiException} to the status it carries and renders every
 * failure as <code>{"error": "&lt;message&gt;"}</code>. Server-side failures
 * are answered with a generic message; their detail only goes to the log.</p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link PriceApiException} to its carried status.
   */
  @ExceptionHandler(PriceApiException.class)
  public ResponseEntity<ApiErrorResponse> handlePriceApiException(PriceApiException ex) {
    if (ex.getKind().isValidationError()) {
      log.warn("Rejected price request: kind={} message={}", ex.getKind(), ex.getMessage());
    }
    return ResponseEntity.status(ex.getStatus()).body(new ApiErrorResponse(ex.getMessage()));
  }

  /**
   * Maps anything else that escapes a controller. Framework exceptions that
   * already describe an HTTP answer (404, 405, ...) keep their status; all
   * other exceptions become a generic 500.
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse) {
      ErrorResponse errorResponse = (ErrorResponse) ex;
      HttpStatusCode status = errorResponse.getStatusCode();
      String detail = errorResponse.getBody().getDetail();
      log.debug("Framework error response {}: {}", status, detail);
      return ResponseEntity.status(status)
          .body(new ApiErrorResponse(detail != null ? detail : ex.getMessage()));
    }

    log.error("Unhandled exception", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(PriceApiException.INTERNAL_MESSAGE));
  }
}
