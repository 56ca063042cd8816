package org.hypertrace.core.panelquery.transform;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.panelquery.PanelQueryServiceConfig;
import org.hypertrace.core.panelquery.TsdbResolution;
import org.hypertrace.core.panelquery.api.DataPoint;
import org.hypertrace.core.panelquery.api.InterpolationFormat;
import org.hypertrace.core.panelquery.api.ProtocolException;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.api.ReconciledSeries;
import org.hypertrace.core.panelquery.api.ScopedVariable;
import org.hypertrace.core.panelquery.api.Target;
import org.hypertrace.core.panelquery.api.TemplateInterpolator;
import org.hypertrace.core.panelquery.normalize.ExpressionTarget;
import org.hypertrace.core.panelquery.normalize.MetricTarget;

/** Builds the rendered form of a reconciled series: its label and its sorted datapoints. */
public class SeriesTransformer {

  private static final String TAG_VARIABLE_PREFIX = "tag_";
  private static final Pattern TAG_PLACEHOLDER = Pattern.compile("\\$tag_([a-zA-Z0-9_./-]+)");
  private static final BigDecimal MIN_MILLIS = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal MAX_MILLIS = BigDecimal.valueOf(Long.MAX_VALUE);

  private final TsdbResolution resolution;
  private final TemplateInterpolator templateInterpolator;

  @Inject
  public SeriesTransformer(
      PanelQueryServiceConfig config, TemplateInterpolator templateInterpolator) {
    this.resolution = config.getOpenTsdbConfig().getResolution();
    this.templateInterpolator = templateInterpolator;
  }

  public ReconciledSeries transformMetric(
      RawSeries series,
      MetricTarget metricTarget,
      Set<String> groupByTags,
      Map<String, ScopedVariable> scopedVars) {
    Target target = metricTarget.getTarget();
    return ReconciledSeries.builder()
        .label(createMetricLabel(series, target, groupByTags, scopedVars))
        .datapoints(toDataPoints(series))
        .refId(target.getRefId())
        .build();
  }

  public ReconciledSeries transformExpression(RawSeries series, ExpressionTarget expressionTarget) {
    Target target = expressionTarget.getTarget();
    return ReconciledSeries.builder()
        .label(createExpressionLabel(series, target))
        .datapoints(toDataPoints(series))
        .refId(target.getRefId())
        .build();
  }

  String createMetricLabel(
      RawSeries series,
      Target target,
      Set<String> groupByTags,
      Map<String, ScopedVariable> scopedVars) {
    if (StringUtils.isNotEmpty(target.getAlias())) {
      Map<String, ScopedVariable> labelVars = new LinkedHashMap<>(scopedVars);
      series
          .getTags()
          .forEach(
              (key, value) -> labelVars.put(TAG_VARIABLE_PREFIX + key, ScopedVariable.of(value)));
      return templateInterpolator.replace(target.getAlias(), labelVars, InterpolationFormat.GLOB);
    }

    String tagData =
        series.getTags().entrySet().stream()
            .filter(tag -> groupByTags.contains(tag.getKey()))
            .map(tag -> tag.getKey() + "=" + tag.getValue())
            .collect(Collectors.joining(", "));
    return tagData.isEmpty() ? series.getMetric() : series.getMetric() + "{" + tagData + "}";
  }

  String createExpressionLabel(RawSeries series, Target target) {
    if (StringUtils.isEmpty(target.getGexpAlias())) {
      return target.getGexp();
    }
    Matcher matcher = TAG_PLACEHOLDER.matcher(target.getGexpAlias());
    StringBuilder label = new StringBuilder();
    while (matcher.find()) {
      String value = series.getTags().get(matcher.group(1));
      matcher.appendReplacement(
          label, Matcher.quoteReplacement(value == null ? matcher.group() : value));
    }
    matcher.appendTail(label);
    return label.toString();
  }

  /** @throws ProtocolException when a timestamp key is not a number or overflows epoch millis */
  List<DataPoint> toDataPoints(RawSeries series) {
    BigDecimal factor = BigDecimal.valueOf(resolution.getToMillisFactor());
    List<DataPoint> dataPoints = new ArrayList<>(series.getDps().size());
    series
        .getDps()
        .forEach(
            (timestamp, value) ->
                dataPoints.add(new DataPoint(toTimestamp(series, timestamp, factor), value)));
    dataPoints.sort(Comparator.comparingLong(DataPoint::getTimestamp));
    return dataPoints;
  }

  private static long toTimestamp(RawSeries series, String timestamp, BigDecimal factor) {
    BigDecimal millis;
    try {
      millis = new BigDecimal(timestamp.trim()).multiply(factor);
    } catch (NumberFormatException e) {
      throw new ProtocolException(
          "series " + series.getMetric(), "non-numeric timestamp '" + timestamp + "'", e);
    }
    if (millis.compareTo(MIN_MILLIS) < 0 || millis.compareTo(MAX_MILLIS) > 0) {
      throw new ProtocolException(
          "series " + series.getMetric(), "timestamp out of range '" + timestamp + "'");
    }
    // sub-millisecond digits are dropped
    return millis.longValue();
  }
}
