package org.hypertrace.core.panelquery.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.normalize.MetricTarget;

abstract class AbstractMetricSeriesReconciler implements MetricSeriesReconciler {

  private final ReconciliationMissRecorder missRecorder;

  AbstractMetricSeriesReconciler(ReconciliationMissRecorder missRecorder) {
    this.missRecorder = missRecorder;
  }

  @Override
  public List<ReconciledRow<MetricTarget>> reconcile(
      List<RawSeries> series, List<MetricTarget> metricTargets) {
    List<ReconciledRow<MetricTarget>> rows = new ArrayList<>(series.size());
    if (metricTargets.isEmpty()) {
      return rows;
    }
    for (RawSeries rawSeries : series) {
      int index =
          findTargetIndex(rawSeries, metricTargets)
              .orElseGet(
                  () -> {
                    missRecorder.recordMetricFallback(
                        rawSeries.getMetric(), describeMiss(rawSeries, metricTargets));
                    return 0;
                  });
      rows.add(new ReconciledRow<>(rawSeries, metricTargets.get(index)));
    }
    return rows;
  }

  /** @return index into {@code metricTargets}, empty when the series cannot be attributed */
  protected abstract Optional<Integer> findTargetIndex(
      RawSeries series, List<MetricTarget> metricTargets);

  protected abstract String describeMiss(RawSeries series, List<MetricTarget> metricTargets);
}
