package org.hypertrace.core.panelquery.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.core.panelquery.api.BuildException;
import org.hypertrace.core.panelquery.api.MetricQuery;
import org.hypertrace.core.panelquery.api.PanelQueryException.Stage;
import org.hypertrace.core.panelquery.api.RateOptions;
import org.hypertrace.core.panelquery.api.ScopedVariable;
import org.hypertrace.core.panelquery.api.TagFilter;
import org.hypertrace.core.panelquery.api.Target;
import org.hypertrace.core.panelquery.template.ScopedVarsTemplateInterpolator;
import org.junit.jupiter.api.Test;

public class TargetNormalizerTest {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final TargetNormalizer normalizer =
      new TargetNormalizer(
          new ScopedVarsTemplateInterpolator(
              Map.of("host", ScopedVariable.ofValues(List.of("web01", "web02")))));

  @Test
  public void testHiddenAndEmptyTargetsAreSkipped() {
    assertTrue(normalize(Target.builder().metric("sys.cpu").hide(true).build()).isEmpty());
    assertTrue(normalize(Target.builder().metric("").build()).isEmpty());
    assertTrue(normalize(Target.builder().queryType("gexp").build()).isEmpty());
  }

  @Test
  public void testUnknownQueryTypeFailsTheBuild() {
    BuildException exception =
        assertThrows(
            BuildException.class,
            () -> normalize(Target.builder().queryType("promql").metric("x").build()));
    assertEquals(Stage.BUILD, exception.getStage());
  }

  @Test
  public void testHiddenTargetWithUnknownTypeIsSkipped() {
    assertTrue(
        normalize(Target.builder().queryType("promql").metric("x").hide(true).build()).isEmpty());
  }

  @Test
  public void testDefaults() {
    MetricQuery query = normalizeMetric(Target.builder().metric("sys.cpu").build());

    assertEquals("sys.cpu", query.getMetric());
    assertEquals("avg", query.getAggregator());
    assertEquals("1m-avg", query.getDownsample());
    assertNull(query.getRate());
    assertNull(query.getRateOptions());
    assertNull(query.getTags());
    assertNull(query.getFilters());
    assertNull(query.getExplicitTags());
  }

  @Test
  public void testDisabledDownsampling() {
    MetricQuery query =
        normalizeMetric(
            Target.builder()
                .metric("sys.cpu")
                .disableDownsampling(true)
                .downsampleInterval("5m")
                .build());

    assertNull(query.getDownsample());
  }

  @Test
  public void testDownsampleWithFillPolicy() {
    assertEquals(
        "5m-max-nan",
        normalizeMetric(
                Target.builder()
                    .metric("m")
                    .downsampleInterval("5m")
                    .downsampleAggregator("max")
                    .downsampleFillPolicy("nan")
                    .build())
            .getDownsample());
    assertEquals(
        "5m-max",
        normalizeMetric(
                Target.builder()
                    .metric("m")
                    .downsampleInterval("5m")
                    .downsampleAggregator("max")
                    .downsampleFillPolicy("none")
                    .build())
            .getDownsample());
  }

  @Test
  public void testFractionalSecondIntervalBecomesMilliseconds() {
    assertEquals(
        "500ms-avg",
        normalizeMetric(Target.builder().metric("m").downsampleInterval("0.5s").build())
            .getDownsample());
    assertEquals(
        "1250ms-avg",
        normalizeMetric(Target.builder().metric("m").downsampleInterval("1.25s").build())
            .getDownsample());
  }

  @Test
  public void testDropResetsTruthTable() {
    assertTrue(rateOptions(null, null).isDropResets());
    assertTrue(rateOptions(null, "0").isDropResets());
    assertFalse(rateOptions(null, "10").isDropResets());
    assertFalse(rateOptions("100", null).isDropResets());
    assertFalse(rateOptions("100", "0").isDropResets());
    assertFalse(rateOptions("100", "10").isDropResets());
  }

  @Test
  public void testRateOptionsParseLeadingIntegers() {
    RateOptions rateOptions = rateOptions("1024abc", "not a number");

    assertEquals(1024L, rateOptions.getCounterMax());
    assertNull(rateOptions.getResetValue());
    assertTrue(rateOptions.isCounter());
  }

  @Test
  public void testFiltersWinOverTags() {
    MetricQuery query =
        normalizeMetric(
            Target.builder()
                .metric("sys.cpu")
                .tag("dc", "lga")
                .filter(
                    TagFilter.builder()
                        .type("literal_or")
                        .tagk("host")
                        .filter("$host")
                        .groupBy(true)
                        .build())
                .build());

    assertNull(query.getTags());
    assertEquals(1, query.getFilters().size());
    assertEquals("web01|web02", query.getFilters().get(0).getFilter());
    assertTrue(query.getFilters().get(0).isGroupBy());
  }

  @Test
  public void testTagValuesArePipeExpandedInOrder() {
    MetricQuery query =
        normalizeMetric(
            Target.builder().metric("sys.cpu").tag("host", "$host").tag("dc", "*").build());

    assertEquals(List.of("host", "dc"), List.copyOf(query.getTags().keySet()));
    assertEquals("web01|web02", query.getTags().get("host"));
    assertEquals("*", query.getTags().get("dc"));
  }

  @Test
  public void testExplicitTagsOnlyWhenSet() {
    assertEquals(
        Boolean.TRUE,
        normalizeMetric(Target.builder().metric("m").explicitTags(true).build())
            .getExplicitTags());
  }

  @Test
  public void testExpressionIsInterpolated() {
    NormalizedTarget normalized =
        normalize(Target.builder().queryType("gexp").gexp("sum(sys.cpu{host=$host})").build())
            .orElseThrow();

    assertEquals(QueryType.GEXP, normalized.getQueryType());
    assertEquals("sum(sys.cpu{host=web01|web02})", ((ExpressionTarget) normalized).getExpression());
  }

  @Test
  public void testNormalizationIsDeterministic() throws Exception {
    Target target =
        Target.builder()
            .metric("sys.cpu")
            .aggregator("sum")
            .tag("host", "$host")
            .tag("dc", "lga")
            .shouldComputeRate(true)
            .counterMax("100")
            .downsampleInterval("0.5s")
            .downsampleFillPolicy("zero")
            .explicitTags(true)
            .build();

    String first = OBJECT_MAPPER.writeValueAsString(normalizeMetric(target));
    String second = OBJECT_MAPPER.writeValueAsString(normalizeMetric(target));

    assertEquals(first, second);
    assertEquals(
        "{\"metric\":\"sys.cpu\",\"aggregator\":\"sum\",\"downsample\":\"500ms-avg-zero\","
            + "\"rate\":true,\"rateOptions\":{\"counter\":false,\"counterMax\":100,"
            + "\"dropResets\":false},\"tags\":{\"host\":\"web01|web02\",\"dc\":\"lga\"},"
            + "\"explicitTags\":true}",
        first);
  }

  @Test
  public void testContainsTemplate() {
    assertTrue(normalizer.containsTemplate(Target.builder().tag("host", "$host").build()));
    assertFalse(normalizer.containsTemplate(Target.builder().tag("host", "web01").build()));
    assertTrue(
        normalizer.containsTemplate(
            Target.builder()
                .tag("host", "web01")
                .filter(TagFilter.builder().tagk("host").filter("[[host]]").build())
                .build()));
  }

  private RateOptions rateOptions(String counterMax, String resetValue) {
    return normalizeMetric(
            Target.builder()
                .metric("m")
                .shouldComputeRate(true)
                .counter(true)
                .counterMax(counterMax)
                .counterResetValue(resetValue)
                .build())
        .getRateOptions();
  }

  private MetricQuery normalizeMetric(Target target) {
    NormalizedTarget normalized = normalize(target).orElseThrow();
    assertEquals(QueryType.METRIC, normalized.getQueryType());
    return ((MetricTarget) normalized).getQuery();
  }

  private Optional<NormalizedTarget> normalize(Target target) {
    return normalizer.normalize(target, 0, Map.of());
  }
}
