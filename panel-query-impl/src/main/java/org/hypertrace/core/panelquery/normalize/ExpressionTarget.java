package org.hypertrace.core.panelquery.normalize;

import org.hypertrace.core.panelquery.api.Target;

public class ExpressionTarget extends NormalizedTarget {
  private final String expression;

  public ExpressionTarget(Target target, int position, String expression) {
    super(target, position);
    this.expression = expression;
  }

  @Override
  public QueryType getQueryType() {
    return QueryType.GEXP;
  }

  /** The expression with template variables already expanded. */
  public String getExpression() {
    return expression;
  }
}
