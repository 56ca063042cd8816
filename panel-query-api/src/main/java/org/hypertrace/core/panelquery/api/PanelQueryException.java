package org.hypertrace.core.panelquery.api;

import lombok.Getter;

/**
 * Failure of a panel evaluation. Any failing sub request fails the whole evaluation, so callers
 * only ever receive one of these per request.
 */
@Getter
public abstract class PanelQueryException extends RuntimeException {

  public enum Stage {
    BUILD,
    TRANSPORT,
    PROTOCOL
  }

  private final Stage stage;

  protected PanelQueryException(Stage stage, String message) {
    super(message);
    this.stage = stage;
  }

  protected PanelQueryException(Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }
}
