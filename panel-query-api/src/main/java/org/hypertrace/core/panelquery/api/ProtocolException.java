package org.hypertrace.core.panelquery.api;

import lombok.Getter;

/**
 * Non-2xx status, or a response body that does not have the expected shape.
 *
 * <p>{@link #getRequestName()} names the failing call: {@code batch} for the metric batch,
 * {@code gexp[i]} for the expression at correlation index {@code i}, {@code series <metric>} for
 * a row whose datapoints cannot be read, and the endpoint path (e.g. {@code api/suggest}) for
 * discovery lookups.
 */
@Getter
public class ProtocolException extends PanelQueryException {
  private final String requestName;
  /** Null when the response arrived but could not be parsed. */
  private final Integer statusCode;
  private final String bodySnippet;

  public ProtocolException(String requestName, int statusCode, String bodySnippet) {
    super(
        Stage.PROTOCOL,
        String.format(
            "Request %s failed with status %d: %s", requestName, statusCode, bodySnippet));
    this.requestName = requestName;
    this.statusCode = statusCode;
    this.bodySnippet = bodySnippet;
  }

  public ProtocolException(String requestName, String message) {
    this(requestName, message, null);
  }

  public ProtocolException(String requestName, String message, Throwable cause) {
    super(Stage.PROTOCOL, String.format("%s: %s", requestName, message), cause);
    this.requestName = requestName;
    this.statusCode = null;
    this.bodySnippet = null;
  }
}
