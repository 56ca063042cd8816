package org.hypertrace.core.panelquery.api;

import lombok.Getter;

/** Network failure, timeout or cancellation of an outbound call. */
@Getter
public class TransportException extends PanelQueryException {
  private final String requestName;

  public TransportException(String requestName, Throwable cause) {
    super(Stage.TRANSPORT, String.format("Request %s failed: %s", requestName, cause), cause);
    this.requestName = requestName;
  }
}
