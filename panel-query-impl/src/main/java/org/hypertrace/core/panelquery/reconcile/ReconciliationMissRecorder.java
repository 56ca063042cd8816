package org.hypertrace.core.panelquery.reconcile;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts rows that could not be attributed to their target with certainty. Such rows are either
 * attributed to the first target or dropped, never failed.
 */
@Singleton
public class ReconciliationMissRecorder {

  private static final Logger LOG = LoggerFactory.getLogger(ReconciliationMissRecorder.class);

  static final String RECONCILIATION_MISSES_COUNTER = "panel.query.reconciliation.misses";
  private static final String KIND_TAG = "kind";

  private final Counter metricMissCounter;
  private final Counter expressionMissCounter;

  @Inject
  public ReconciliationMissRecorder(MeterRegistry meterRegistry) {
    this.metricMissCounter =
        Counter.builder(RECONCILIATION_MISSES_COUNTER)
            .tag(KIND_TAG, "metric")
            .register(meterRegistry);
    this.expressionMissCounter =
        Counter.builder(RECONCILIATION_MISSES_COUNTER)
            .tag(KIND_TAG, "expression")
            .register(meterRegistry);
  }

  void recordMetricFallback(String metric, String reason) {
    LOG.warn("Attributing series {} to the first metric target: {}", metric, reason);
    metricMissCounter.increment();
  }

  void recordExpressionFallback(String reason) {
    LOG.warn("Attributing expression response to the first expression target: {}", reason);
    expressionMissCounter.increment();
  }

  void recordExpressionDrop(int echoedIndex, int droppedRows) {
    LOG.warn(
        "Dropping {} expression rows echoed with unknown index {}", droppedRows, echoedIndex);
    expressionMissCounter.increment(droppedRows);
  }
}
