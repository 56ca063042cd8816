package org.hypertrace.core.panelquery.api;

/** How a multi-value template variable is expanded into query text. */
public enum InterpolationFormat {
  /** {@code v1|v2}, as understood by OpenTSDB literal_or filters and tag values. */
  PIPE,
  /** {@code {v1,v2}} */
  GLOB,
  /** {@code v1,v2} */
  CSV
}
