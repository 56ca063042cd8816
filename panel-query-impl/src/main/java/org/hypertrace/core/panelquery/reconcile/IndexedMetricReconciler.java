package org.hypertrace.core.panelquery.reconcile;

import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.normalize.MetricTarget;

/** For version 3 backends, which echo the origin index of every series under {@code query}. */
public class IndexedMetricReconciler extends AbstractMetricSeriesReconciler {

  @Inject
  public IndexedMetricReconciler(ReconciliationMissRecorder missRecorder) {
    super(missRecorder);
  }

  @Override
  protected Optional<Integer> findTargetIndex(RawSeries series, List<MetricTarget> metricTargets) {
    return series.getQueryIndex().filter(index -> index >= 0 && index < metricTargets.size());
  }

  @Override
  protected String describeMiss(RawSeries series, List<MetricTarget> metricTargets) {
    return series
        .getQueryIndex()
        .map(index -> "query index " + index + " out of range for " + metricTargets.size())
        .orElse("no query index echoed");
  }
}
