package org.hypertrace.core.panelquery.reconcile;

import java.util.List;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.normalize.MetricTarget;

/** Maps the rows of a batch response back to the metric targets that made up the batch. */
public interface MetricSeriesReconciler {

  /**
   * @param series rows in response order
   * @param metricTargets targets in the order their queries were placed in the batch
   * @return one row per series, in response order
   */
  List<ReconciledRow<MetricTarget>> reconcile(
      List<RawSeries> series, List<MetricTarget> metricTargets);
}
