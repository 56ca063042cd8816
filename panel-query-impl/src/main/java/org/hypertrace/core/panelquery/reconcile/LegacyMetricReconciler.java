package org.hypertrace.core.panelquery.reconcile;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import javax.inject.Inject;
import org.hypertrace.core.panelquery.api.MetricQuery;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.normalize.MetricTarget;

/**
 * For backends that do not echo the origin index. A series belongs to the first query with the
 * same metric whose tags all match the series; queries using filters match on the metric alone.
 */
public class LegacyMetricReconciler extends AbstractMetricSeriesReconciler {

  private static final String WILDCARD = "*";
  private static final String VALUE_SEPARATOR_REGEX = "\\|";

  @Inject
  public LegacyMetricReconciler(ReconciliationMissRecorder missRecorder) {
    super(missRecorder);
  }

  @Override
  protected Optional<Integer> findTargetIndex(RawSeries series, List<MetricTarget> metricTargets) {
    return IntStream.range(0, metricTargets.size())
        .filter(index -> matches(metricTargets.get(index).getQuery(), series))
        .boxed()
        .findFirst();
  }

  @Override
  protected String describeMiss(RawSeries series, List<MetricTarget> metricTargets) {
    return "no query matches tags " + series.getTags();
  }

  static boolean matches(MetricQuery query, RawSeries series) {
    if (!query.getMetric().equals(series.getMetric())) {
      return false;
    }
    if (query.hasFilters() || query.getTags() == null) {
      return true;
    }
    return query.getTags().entrySet().stream()
        .allMatch(tag -> tagMatches(tag, series.getTags().get(tag.getKey())));
  }

  private static boolean tagMatches(Map.Entry<String, String> tag, String seriesValue) {
    String declared = tag.getValue();
    if (WILDCARD.equals(declared)) {
      return true;
    }
    return declared != null
        && Arrays.asList(declared.split(VALUE_SEPARATOR_REGEX)).contains(seriesValue);
  }
}
