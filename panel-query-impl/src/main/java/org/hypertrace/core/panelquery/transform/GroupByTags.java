package org.hypertrace.core.panelquery.transform;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.panelquery.api.MetricQuery;
import org.hypertrace.core.panelquery.api.TagFilter;
import org.hypertrace.core.panelquery.normalize.MetricTarget;

/** Tag keys shown in generated series labels, shared by every metric target of a panel. */
public class GroupByTags {

  private GroupByTags() {}

  public static Set<String> collect(List<MetricTarget> metricTargets) {
    Set<String> groupByTags = new LinkedHashSet<>();
    for (MetricTarget metricTarget : metricTargets) {
      MetricQuery query = metricTarget.getQuery();
      if (query.hasFilters()) {
        query.getFilters().stream().map(TagFilter::getTagk).forEach(groupByTags::add);
      } else if (query.getTags() != null) {
        groupByTags.addAll(query.getTags().keySet());
      }
    }
    return groupByTags;
  }
}
