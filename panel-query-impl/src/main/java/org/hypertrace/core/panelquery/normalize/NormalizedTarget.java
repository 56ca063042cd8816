package org.hypertrace.core.panelquery.normalize;

import org.hypertrace.core.panelquery.api.Target;

/**
 * A target that passed normalization. Exactly one of {@link MetricTarget} or {@link
 * ExpressionTarget}; downstream code never looks at raw target fields again except for labels.
 */
public abstract class NormalizedTarget {
  private final Target target;
  private final int position;

  NormalizedTarget(Target target, int position) {
    this.target = target;
    this.position = position;
  }

  public abstract QueryType getQueryType();

  public Target getTarget() {
    return target;
  }

  /** Declaration position of the target within its panel. */
  public int getPosition() {
    return position;
  }
}
