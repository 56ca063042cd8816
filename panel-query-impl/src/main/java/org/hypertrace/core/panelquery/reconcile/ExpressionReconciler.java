package org.hypertrace.core.panelquery.reconcile;

import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.normalize.ExpressionTarget;
import org.hypertrace.core.panelquery.opentsdb.ExpressionResponse;

/**
 * Pairs every expression response with the target whose {@code gexpIndex} it echoes back, so the
 * order in which responses arrive does not matter.
 */
public class ExpressionReconciler {

  private final ReconciliationMissRecorder missRecorder;

  @Inject
  public ExpressionReconciler(ReconciliationMissRecorder missRecorder) {
    this.missRecorder = missRecorder;
  }

  public List<ReconciledRow<ExpressionTarget>> reconcile(
      List<ExpressionResponse> responses, List<ExpressionTarget> expressionTargets) {
    List<ReconciledRow<ExpressionTarget>> rows = new ArrayList<>();
    for (ExpressionResponse response : responses) {
      int index =
          response
              .getEchoedIndex()
              .orElseGet(
                  () -> {
                    missRecorder.recordExpressionFallback("no gexpIndex in request url");
                    return 0;
                  });
      if (index < 0 || index >= expressionTargets.size()) {
        if (!response.getSeries().isEmpty()) {
          missRecorder.recordExpressionDrop(index, response.getSeries().size());
        }
        continue;
      }
      ExpressionTarget target = expressionTargets.get(index);
      for (RawSeries series : response.getSeries()) {
        rows.add(new ReconciledRow<>(series, target));
      }
    }
    return rows;
  }
}
