package io.github.themoah.facetscope.clickhouse;

/**
 * Raised when an aggregation call fails or returns an unusable response.
 */
public class AggregationException extends RuntimeException {

  private final int statusCode;

  public AggregationException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public AggregationException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /**
   * HTTP status returned by the store, or -1 when the failure happened before a response.
   */
  public int statusCode() {
    return statusCode;
  }

  public boolean isAuthenticationFailure() {
    String message = getMessage();
    return statusCode == 401
      || (message != null && (message.contains("Authentication failed") || message.contains("REQUIRED_PASSWORD")));
  }
}
