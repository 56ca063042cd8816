package org.hypertrace.core.panelquery.normalize;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.panelquery.api.BuildException;
import org.hypertrace.core.panelquery.api.InterpolationFormat;
import org.hypertrace.core.panelquery.api.MetricQuery;
import org.hypertrace.core.panelquery.api.RateOptions;
import org.hypertrace.core.panelquery.api.ScopedVariable;
import org.hypertrace.core.panelquery.api.TagFilter;
import org.hypertrace.core.panelquery.api.Target;
import org.hypertrace.core.panelquery.api.TemplateInterpolator;

/**
 * Turns a raw panel target into a {@link MetricTarget} or an {@link ExpressionTarget}, filling in
 * defaults along the way. Field values are not validated beyond their shape; OpenTSDB rejects
 * anything it cannot run.
 */
public class TargetNormalizer {

  private static final String DEFAULT_AGGREGATOR = "avg";
  private static final String DEFAULT_DOWNSAMPLE_INTERVAL = "1m";
  private static final String DEFAULT_DOWNSAMPLE_AGGREGATOR = "avg";
  private static final String FILL_POLICY_NONE = "none";

  private static final Pattern FRACTIONAL_SECONDS = Pattern.compile("\\.[0-9]+s");
  private static final Pattern LEADING_DECIMAL = Pattern.compile("^\\s*([-+]?[0-9]*\\.?[0-9]+)");
  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([-+]?[0-9]+)");

  private final TemplateInterpolator templateInterpolator;

  @Inject
  public TargetNormalizer(TemplateInterpolator templateInterpolator) {
    this.templateInterpolator = templateInterpolator;
  }

  /**
   * @return empty when the target is hidden or has nothing to query
   * @throws BuildException when the query type is not one we know how to send
   */
  public Optional<NormalizedTarget> normalize(
      Target target, int position, Map<String, ScopedVariable> scopedVars) {
    if (target.isHide()) {
      return Optional.empty();
    }

    QueryType queryType =
        StringUtils.isEmpty(target.getQueryType())
            ? QueryType.METRIC
            : QueryType.fromName(target.getQueryType())
                .orElseThrow(
                    () -> new BuildException("Unrecognized query type: " + target.getQueryType()));

    switch (queryType) {
      case METRIC:
        if (StringUtils.isEmpty(target.getMetric())) {
          return Optional.empty();
        }
        return Optional.of(new MetricTarget(target, position, toMetricQuery(target, scopedVars)));
      case GEXP:
        if (StringUtils.isEmpty(target.getGexp())) {
          return Optional.empty();
        }
        String expression = interpolate(target.getGexp(), scopedVars, InterpolationFormat.PIPE);
        return Optional.of(new ExpressionTarget(target, position, expression));
      default:
        throw new BuildException("Unrecognized query type: " + queryType);
    }
  }

  /** Whether any tag or filter value of the target references a template variable. */
  public boolean containsTemplate(Target target) {
    if (!target.getFilters().isEmpty()) {
      return target.getFilters().stream()
          .anyMatch(filter -> templateInterpolator.variableExists(filter.getFilter()));
    }
    return target.getTags().values().stream().anyMatch(templateInterpolator::variableExists);
  }

  private MetricQuery toMetricQuery(Target target, Map<String, ScopedVariable> scopedVars) {
    MetricQuery.MetricQueryBuilder builder =
        MetricQuery.builder()
            .metric(interpolate(target.getMetric(), scopedVars, InterpolationFormat.PIPE))
            .aggregator(
                StringUtils.isEmpty(target.getAggregator())
                    ? DEFAULT_AGGREGATOR
                    : interpolate(target.getAggregator(), scopedVars, InterpolationFormat.GLOB));

    if (target.isShouldComputeRate()) {
      builder.rate(true).rateOptions(toRateOptions(target));
    }

    if (!target.isDisableDownsampling()) {
      builder.downsample(toDownsample(target, scopedVars));
    }

    if (!target.getFilters().isEmpty()) {
      builder.filters(interpolateFilters(target.getFilters(), scopedVars));
    } else if (!target.getTags().isEmpty()) {
      builder.tags(interpolateTags(target.getTags(), scopedVars));
    }

    if (target.isExplicitTags()) {
      builder.explicitTags(true);
    }

    return builder.build();
  }

  private RateOptions toRateOptions(Target target) {
    Optional<Long> counterMax = parseLeadingInteger(target.getCounterMax());
    Optional<Long> resetValue = parseLeadingInteger(target.getCounterResetValue());
    // matches what OpenTSDB does on its own when neither bound is given
    boolean dropResets =
        counterMax.isEmpty() && resetValue.map(value -> value == 0L).orElse(true);
    return RateOptions.builder()
        .counter(target.isCounter())
        .counterMax(counterMax.orElse(null))
        .resetValue(resetValue.orElse(null))
        .dropResets(dropResets)
        .build();
  }

  private String toDownsample(Target target, Map<String, ScopedVariable> scopedVars) {
    String interval =
        StringUtils.isBlank(target.getDownsampleInterval())
            ? DEFAULT_DOWNSAMPLE_INTERVAL
            : interpolate(target.getDownsampleInterval(), scopedVars, InterpolationFormat.GLOB);
    if (StringUtils.isBlank(interval)) {
      interval = DEFAULT_DOWNSAMPLE_INTERVAL;
    }
    if (FRACTIONAL_SECONDS.matcher(interval).find()) {
      interval = toMillisecondInterval(interval);
    }

    String aggregator =
        StringUtils.defaultIfBlank(target.getDownsampleAggregator(), DEFAULT_DOWNSAMPLE_AGGREGATOR);
    String downsample = interval + "-" + aggregator;

    String fillPolicy = target.getDownsampleFillPolicy();
    if (StringUtils.isNotBlank(fillPolicy) && !FILL_POLICY_NONE.equals(fillPolicy)) {
      downsample += "-" + fillPolicy;
    }
    return downsample;
  }

  /** {@code 0.5s} becomes {@code 500ms}; OpenTSDB only accepts integral interval values. */
  private static String toMillisecondInterval(String interval) {
    Matcher matcher = LEADING_DECIMAL.matcher(interval);
    if (!matcher.find()) {
      return interval;
    }
    return new BigDecimal(matcher.group(1)).movePointRight(3).stripTrailingZeros().toPlainString()
        + "ms";
  }

  private List<TagFilter> interpolateFilters(
      List<TagFilter> filters, Map<String, ScopedVariable> scopedVars) {
    return filters.stream()
        .map(
            filter ->
                filter.withFilter(
                    interpolate(filter.getFilter(), scopedVars, InterpolationFormat.PIPE)))
        .collect(Collectors.toUnmodifiableList());
  }

  private Map<String, String> interpolateTags(
      Map<String, String> tags, Map<String, ScopedVariable> scopedVars) {
    Map<String, String> interpolated = new LinkedHashMap<>();
    tags.forEach(
        (key, value) ->
            interpolated.put(key, interpolate(value, scopedVars, InterpolationFormat.PIPE)));
    return interpolated;
  }

  private String interpolate(
      String text, Map<String, ScopedVariable> scopedVars, InterpolationFormat format) {
    if (text == null) {
      return null;
    }
    return templateInterpolator.replace(text, scopedVars, format);
  }

  private static Optional<Long> parseLeadingInteger(String text) {
    if (StringUtils.isEmpty(text)) {
      return Optional.empty();
    }
    Matcher matcher = LEADING_INTEGER.matcher(text);
    if (!matcher.find()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(matcher.group(1)));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
