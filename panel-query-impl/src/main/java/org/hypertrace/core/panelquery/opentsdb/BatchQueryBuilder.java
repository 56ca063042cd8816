package org.hypertrace.core.panelquery.opentsdb;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.panelquery.PanelQueryServiceConfig;
import org.hypertrace.core.panelquery.PanelQueryServiceConfig.OpenTsdbConfig;
import org.hypertrace.core.panelquery.TsdbResolution;
import org.hypertrace.core.panelquery.api.BatchRequest;
import org.hypertrace.core.panelquery.api.ExpressionRequest;
import org.hypertrace.core.panelquery.api.MetricQuery;
import org.hypertrace.core.panelquery.api.TimeWindow;
import org.hypertrace.core.panelquery.normalize.ExpressionTarget;
import org.hypertrace.core.panelquery.normalize.MetricTarget;

/** Assembles the outbound requests for one panel evaluation. */
public class BatchQueryBuilder {

  private static final String ANNOTATION_AGGREGATOR = "sum";

  private final OpenTsdbConfig openTsdbConfig;

  @Inject
  public BatchQueryBuilder(PanelQueryServiceConfig config) {
    this.openTsdbConfig = config.getOpenTsdbConfig();
  }

  /** @return empty when there are no metric targets, so no call needs to be made */
  public Optional<BatchRequest> buildBatchRequest(
      TimeWindow window, List<MetricTarget> metricTargets) {
    if (metricTargets.isEmpty()) {
      return Optional.empty();
    }
    BatchRequest.BatchRequestBuilder builder = newBatchRequestBuilder(window);
    metricTargets.forEach(target -> builder.query(target.getQuery()));
    return Optional.of(builder.build());
  }

  /**
   * One request per expression target, indexed by the target's position among the expression
   * targets that were built.
   */
  public List<ExpressionRequest> buildExpressionRequests(
      TimeWindow window, List<ExpressionTarget> expressionTargets) {
    List<ExpressionRequest> requests = new ArrayList<>(expressionTargets.size());
    for (int index = 0; index < expressionTargets.size(); index++) {
      requests.add(
          new ExpressionRequest(window, expressionTargets.get(index).getExpression(), index));
    }
    return requests;
  }

  public BatchRequest buildAnnotationRequest(TimeWindow window, String annotationMetric) {
    MetricQuery annotationQuery =
        MetricQuery.builder().metric(annotationMetric).aggregator(ANNOTATION_AGGREGATOR).build();
    return newBatchRequestBuilder(window).query(annotationQuery).build();
  }

  private BatchRequest.BatchRequestBuilder newBatchRequestBuilder(TimeWindow window) {
    return BatchRequest.builder()
        .start(window.getStartMs())
        .end(window.getEndMs())
        .msResolution(openTsdbConfig.getResolution() == TsdbResolution.MILLISECOND)
        .globalAnnotations(true)
        .showQuery(openTsdbConfig.isQueryIndexEchoed() ? Boolean.TRUE : null);
  }
}
