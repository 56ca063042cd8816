package org.hypertrace.core.panelquery.api;

/** A target or request that cannot be turned into an OpenTSDB request. */
public class BuildException extends PanelQueryException {

  public BuildException(String message) {
    super(Stage.BUILD, message);
  }

  public BuildException(String message, Throwable cause) {
    super(Stage.BUILD, message, cause);
  }
}
