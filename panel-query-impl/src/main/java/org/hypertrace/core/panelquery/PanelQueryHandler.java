package org.hypertrace.core.panelquery;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.hypertrace.core.panelquery.api.Annotation;
import org.hypertrace.core.panelquery.api.AnnotationEvent;
import org.hypertrace.core.panelquery.api.BatchRequest;
import org.hypertrace.core.panelquery.api.ExpressionRequest;
import org.hypertrace.core.panelquery.api.PanelQueryRequest;
import org.hypertrace.core.panelquery.api.PanelQueryResponse;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.api.ReconciledSeries;
import org.hypertrace.core.panelquery.api.ScopedVariable;
import org.hypertrace.core.panelquery.api.Target;
import org.hypertrace.core.panelquery.api.TimeWindow;
import org.hypertrace.core.panelquery.discovery.TagKeyCache;
import org.hypertrace.core.panelquery.normalize.ExpressionTarget;
import org.hypertrace.core.panelquery.normalize.MetricTarget;
import org.hypertrace.core.panelquery.normalize.NormalizedTarget;
import org.hypertrace.core.panelquery.normalize.TargetNormalizer;
import org.hypertrace.core.panelquery.opentsdb.BatchQueryBuilder;
import org.hypertrace.core.panelquery.opentsdb.DispatchResult;
import org.hypertrace.core.panelquery.opentsdb.OpenTsdbRestClient;
import org.hypertrace.core.panelquery.reconcile.ExpressionReconciler;
import org.hypertrace.core.panelquery.reconcile.MetricSeriesReconciler;
import org.hypertrace.core.panelquery.reconcile.ReconciledRow;
import org.hypertrace.core.panelquery.transform.GroupByTags;
import org.hypertrace.core.panelquery.transform.SeriesTransformer;
import org.hypertrace.core.panelquery.utils.RxFutureUtil;

/**
 * Runs one panel refresh end to end: normalize the targets, send one batch call plus one call per
 * expression, attribute every returned row to its target and render the rows in target order.
 * Disposing the returned single cancels every call still in flight.
 */
@Singleton
@Slf4j
public class PanelQueryHandler {

  static final String PANEL_QUERY_REQUESTS_STATUS_COUNTER = "panel.query.requests.status";
  private static final long MILLIS_PER_SECOND = 1000L;

  private final TargetNormalizer targetNormalizer;
  private final BatchQueryBuilder batchQueryBuilder;
  private final OpenTsdbRestClient restClient;
  private final MetricSeriesReconciler metricSeriesReconciler;
  private final ExpressionReconciler expressionReconciler;
  private final SeriesTransformer seriesTransformer;
  private final TagKeyCache tagKeyCache;

  private final Counter requestStatusErrorCounter;
  private final Counter requestStatusSuccessCounter;

  @Inject
  public PanelQueryHandler(
      TargetNormalizer targetNormalizer,
      BatchQueryBuilder batchQueryBuilder,
      OpenTsdbRestClient restClient,
      MetricSeriesReconciler metricSeriesReconciler,
      ExpressionReconciler expressionReconciler,
      SeriesTransformer seriesTransformer,
      TagKeyCache tagKeyCache,
      MeterRegistry meterRegistry) {
    this.targetNormalizer = targetNormalizer;
    this.batchQueryBuilder = batchQueryBuilder;
    this.restClient = restClient;
    this.metricSeriesReconciler = metricSeriesReconciler;
    this.expressionReconciler = expressionReconciler;
    this.seriesTransformer = seriesTransformer;
    this.tagKeyCache = tagKeyCache;
    this.requestStatusErrorCounter =
        Counter.builder(PANEL_QUERY_REQUESTS_STATUS_COUNTER)
            .tag("error", "true")
            .register(meterRegistry);
    this.requestStatusSuccessCounter =
        Counter.builder(PANEL_QUERY_REQUESTS_STATUS_COUNTER)
            .tag("error", "false")
            .register(meterRegistry);
  }

  public Single<PanelQueryResponse> handleRequest(PanelQueryRequest request) {
    return Single.defer(() -> execute(request))
        .doOnError(
            error -> {
              log.error("Panel query failed: {}", request, error);
              requestStatusErrorCounter.increment();
            })
        .doOnSuccess(response -> requestStatusSuccessCounter.increment());
  }

  /**
   * Reads the annotations attached to the first series returned for {@code annotationMetric}.
   *
   * @param global whether to read the global annotations instead of the series' own
   */
  public Single<List<AnnotationEvent>> handleAnnotationRequest(
      TimeWindow window, String annotationMetric, boolean global) {
    return Single.defer(
            () -> {
              BatchRequest batchRequest =
                  batchQueryBuilder.buildAnnotationRequest(window, annotationMetric);
              return RxFutureUtil.toSingle(
                  () -> restClient.execute(Optional.of(batchRequest), List.of()));
            })
        .map(result -> toAnnotationEvents(result.getBatchSeries(), global))
        .doOnError(error -> log.error("Annotation query failed for {}", annotationMetric, error));
  }

  private Single<PanelQueryResponse> execute(PanelQueryRequest request) {
    List<MetricTarget> metricTargets = new ArrayList<>();
    List<ExpressionTarget> expressionTargets = new ArrayList<>();
    List<Target> targets = request.getTargets();
    for (int position = 0; position < targets.size(); position++) {
      Optional<NormalizedTarget> normalized =
          targetNormalizer.normalize(targets.get(position), position, request.getScopedVars());
      if (normalized.isEmpty()) {
        continue;
      }
      switch (normalized.get().getQueryType()) {
        case METRIC:
          metricTargets.add((MetricTarget) normalized.get());
          break;
        case GEXP:
          expressionTargets.add((ExpressionTarget) normalized.get());
          break;
        default:
          throw new IllegalStateException("Unhandled query type " + normalized.get());
      }
    }

    if (metricTargets.isEmpty() && expressionTargets.isEmpty()) {
      log.debug("No queryable targets, skipping the round trip");
      return Single.just(PanelQueryResponse.EMPTY);
    }

    Optional<BatchRequest> batchRequest =
        batchQueryBuilder.buildBatchRequest(request.getWindow(), metricTargets);
    List<ExpressionRequest> expressionRequests =
        batchQueryBuilder.buildExpressionRequests(request.getWindow(), expressionTargets);

    return RxFutureUtil.toSingle(() -> restClient.execute(batchRequest, expressionRequests))
        .map(
            result ->
                assemble(result, metricTargets, expressionTargets, request.getScopedVars()));
  }

  private PanelQueryResponse assemble(
      DispatchResult result,
      List<MetricTarget> metricTargets,
      List<ExpressionTarget> expressionTargets,
      Map<String, ScopedVariable> scopedVars) {
    Set<String> groupByTags = GroupByTags.collect(metricTargets);
    List<ImmutablePair<Integer, ReconciledSeries>> positioned = new ArrayList<>();

    for (ReconciledRow<MetricTarget> row :
        metricSeriesReconciler.reconcile(result.getBatchSeries(), metricTargets)) {
      tagKeyCache.save(row.getSeries());
      positioned.add(
          ImmutablePair.of(
              row.getTarget().getPosition(),
              seriesTransformer.transformMetric(
                  row.getSeries(), row.getTarget(), groupByTags, scopedVars)));
    }
    for (ReconciledRow<ExpressionTarget> row :
        expressionReconciler.reconcile(result.getExpressionResponses(), expressionTargets)) {
      positioned.add(
          ImmutablePair.of(
              row.getTarget().getPosition(),
              seriesTransformer.transformExpression(row.getSeries(), row.getTarget())));
    }

    // List.sort is stable, so rows of one target keep their response order
    positioned.sort(Comparator.comparingInt(pair -> pair.getLeft()));
    return new PanelQueryResponse(
        positioned.stream().map(ImmutablePair::getRight).collect(Collectors.toUnmodifiableList()));
  }

  private static List<AnnotationEvent> toAnnotationEvents(List<RawSeries> series, boolean global) {
    if (series.isEmpty()) {
      return List.of();
    }
    RawSeries first = series.get(0);
    List<Annotation> annotations = global ? first.getGlobalAnnotations() : first.getAnnotations();
    return annotations.stream()
        .map(
            annotation ->
                new AnnotationEvent(
                    annotation.getDescription(),
                    (long) Math.floor(annotation.getStartTime()) * MILLIS_PER_SECOND))
        .collect(Collectors.toUnmodifiableList());
  }
}
