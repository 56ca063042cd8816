package org.hypertrace.core.panelquery.discovery;

import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.panelquery.api.InterpolationFormat;
import org.hypertrace.core.panelquery.api.TemplateInterpolator;

/**
 * Resolves the values of a dashboard template variable defined by a query such as {@code
 * metrics(sys.)}, {@code tag_names(sys.cpu)}, {@code tag_values(sys.cpu, host)}, {@code
 * suggest_tagk(ho)} or {@code suggest_tagv(web)}.
 */
public class MetricFindQueryResolver {

  private static final Pattern METRICS = Pattern.compile("metrics\\((.*)\\)");
  private static final Pattern TAG_NAMES = Pattern.compile("tag_names\\((.*)\\)");
  private static final Pattern TAG_VALUES = Pattern.compile("tag_values\\((.*?),\\s?(.*)\\)");
  private static final Pattern SUGGEST_TAG_KEYS = Pattern.compile("suggest_tagk\\((.*)\\)");
  private static final Pattern SUGGEST_TAG_VALUES = Pattern.compile("suggest_tagv\\((.*)\\)");

  private final OpenTsdbDiscoveryClient discoveryClient;
  private final TemplateInterpolator templateInterpolator;

  @Inject
  public MetricFindQueryResolver(
      OpenTsdbDiscoveryClient discoveryClient, TemplateInterpolator templateInterpolator) {
    this.discoveryClient = discoveryClient;
    this.templateInterpolator = templateInterpolator;
  }

  /** @return empty when the query is blank or not one of the supported functions */
  public Single<List<String>> resolve(String query) {
    if (StringUtils.isBlank(query)) {
      return Single.just(List.of());
    }
    String interpolated = templateInterpolator.replace(query, Map.of(), InterpolationFormat.CSV);

    Matcher matcher = METRICS.matcher(interpolated);
    if (matcher.find()) {
      return discoveryClient.suggest(SuggestType.METRICS, matcher.group(1));
    }
    matcher = TAG_NAMES.matcher(interpolated);
    if (matcher.find()) {
      return discoveryClient.lookupTagKeys(matcher.group(1));
    }
    matcher = TAG_VALUES.matcher(interpolated);
    if (matcher.find()) {
      return discoveryClient.lookupTagValues(matcher.group(1), matcher.group(2));
    }
    matcher = SUGGEST_TAG_KEYS.matcher(interpolated);
    if (matcher.find()) {
      return discoveryClient.suggest(SuggestType.TAGK, matcher.group(1));
    }
    matcher = SUGGEST_TAG_VALUES.matcher(interpolated);
    if (matcher.find()) {
      return discoveryClient.suggest(SuggestType.TAGV, matcher.group(1));
    }
    return Single.just(List.of());
  }
}
