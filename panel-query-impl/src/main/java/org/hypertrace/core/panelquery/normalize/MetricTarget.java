package org.hypertrace.core.panelquery.normalize;

import org.hypertrace.core.panelquery.api.MetricQuery;
import org.hypertrace.core.panelquery.api.Target;

public class MetricTarget extends NormalizedTarget {
  private final MetricQuery query;

  public MetricTarget(Target target, int position, MetricQuery query) {
    super(target, position);
    this.query = query;
  }

  @Override
  public QueryType getQueryType() {
    return QueryType.METRIC;
  }

  public MetricQuery getQuery() {
    return query;
  }
}
