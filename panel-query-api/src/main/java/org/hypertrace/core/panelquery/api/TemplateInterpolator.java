package org.hypertrace.core.panelquery.api;

import java.util.Map;

/**
 * Template variable substitution provided by the dashboard. Implementations resolve variables
 * from the given scope first and fall back to their own globally defined variables.
 */
public interface TemplateInterpolator {

  String replace(String text, Map<String, ScopedVariable> scopedVars, InterpolationFormat format);

  /** Whether the text references a variable this interpolator knows about. */
  boolean variableExists(String text);
}
