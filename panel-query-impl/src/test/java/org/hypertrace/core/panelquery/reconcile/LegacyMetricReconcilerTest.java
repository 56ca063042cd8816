package org.hypertrace.core.panelquery.reconcile;

import static org.hypertrace.core.panelquery.reconcile.ReconcilerTestUtils.filteredMetricTarget;
import static org.hypertrace.core.panelquery.reconcile.ReconcilerTestUtils.metricTarget;
import static org.hypertrace.core.panelquery.reconcile.ReconcilerTestUtils.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.panelquery.normalize.MetricTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LegacyMetricReconcilerTest {

  private SimpleMeterRegistry meterRegistry;
  private LegacyMetricReconciler reconciler;

  @BeforeEach
  public void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    reconciler = new LegacyMetricReconciler(new ReconciliationMissRecorder(meterRegistry));
  }

  @Test
  public void testPipeSeparatedTagValues() {
    MetricTarget target = metricTarget(0, "sys.cpu", Map.of("host", "a|b"));

    assertTrue(
        LegacyMetricReconciler.matches(target.getQuery(), series("sys.cpu", Map.of("host", "b"))));
    assertFalse(
        LegacyMetricReconciler.matches(target.getQuery(), series("sys.cpu", Map.of("host", "c"))));
  }

  @Test
  public void testWildcardMatchesAnyValue() {
    MetricTarget target = metricTarget(0, "sys.cpu", Map.of("host", "*"));

    assertTrue(
        LegacyMetricReconciler.matches(
            target.getQuery(), series("sys.cpu", Map.of("host", "anything"))));
    assertFalse(
        LegacyMetricReconciler.matches(
            target.getQuery(), series("sys.mem", Map.of("host", "anything"))));
  }

  @Test
  public void testFilteredQueriesMatchOnMetricOnly() {
    MetricTarget target = filteredMetricTarget(0, "sys.cpu", "host");

    assertTrue(
        LegacyMetricReconciler.matches(target.getQuery(), series("sys.cpu", Map.of("dc", "x"))));
  }

  @Test
  public void testFirstMatchingTargetWins() {
    List<MetricTarget> targets =
        List.of(
            metricTarget(0, "sys.mem", Map.of()),
            metricTarget(1, "sys.cpu", Map.of("host", "web01")),
            metricTarget(2, "sys.cpu", Map.of("host", "*")),
            metricTarget(3, "sys.cpu", Map.of("host", "web02")));

    List<ReconciledRow<MetricTarget>> rows =
        reconciler.reconcile(
            List.of(
                series("sys.cpu", Map.of("host", "web02")),
                series("sys.cpu", Map.of("host", "web01")),
                series("sys.mem", Map.of())),
            targets);

    assertEquals(2, rows.get(0).getTarget().getPosition());
    assertEquals(1, rows.get(1).getTarget().getPosition());
    assertEquals(0, rows.get(2).getTarget().getPosition());
    assertEquals(0, misses());
  }

  @Test
  public void testUnmatchedSeriesFallsBackToFirstTarget() {
    List<MetricTarget> targets =
        List.of(
            metricTarget(0, "sys.cpu", Map.of("host", "web01")),
            metricTarget(1, "sys.cpu", Map.of("host", "web02")));

    List<ReconciledRow<MetricTarget>> rows =
        reconciler.reconcile(List.of(series("sys.cpu", Map.of("host", "web03"))), targets);

    assertEquals(1, rows.size());
    assertEquals(0, rows.get(0).getTarget().getPosition());
    assertEquals(1, misses());
  }

  private double misses() {
    return meterRegistry
        .counter(ReconciliationMissRecorder.RECONCILIATION_MISSES_COUNTER, "kind", "metric")
        .count();
  }
}
