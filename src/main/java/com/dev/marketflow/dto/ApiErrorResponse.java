package com.dev.marketflow.dto;

/**
 * Standard error payload returned by the MarketFlow API:
 * <code>{"error": "&lt;message&gt;"}</code>.
 */
public class ApiErrorResponse {

  private final String error;

  /**
   * Creates a new standardized API error response.
   *
   * @param error human-readable error description
   */
  public ApiErrorResponse(String error) {
    this.error = error;
  }

  public String getError() {
    return error;
  }
}
