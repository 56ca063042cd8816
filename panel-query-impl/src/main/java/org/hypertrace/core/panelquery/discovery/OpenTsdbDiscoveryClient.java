package org.hypertrace.core.panelquery.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.panelquery.PanelQueryServiceConfig;
import org.hypertrace.core.panelquery.opentsdb.OpenTsdbRestClient;
import org.hypertrace.core.panelquery.utils.RxFutureUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Autocomplete lookups against OpenTSDB. None of these are used when running panel queries. */
@Singleton
public class OpenTsdbDiscoveryClient {

  private static final Logger LOG = LoggerFactory.getLogger(OpenTsdbDiscoveryClient.class);

  private static final String SUGGEST_PATH = "api/suggest";
  private static final String LOOKUP_PATH = "api/search/lookup";
  private static final String AGGREGATORS_PATH = "api/aggregators";
  private static final String FILTERS_PATH = "api/config/filters";
  private static final int TAG_KEY_LOOKUP_LIMIT = 1000;
  private static final String CONNECTION_TEST_QUERY = "cpu";

  private final OpenTsdbRestClient restClient;
  private final TagKeyCache tagKeyCache;
  private final int lookupLimit;
  private final Single<List<String>> aggregators;
  private final Single<List<String>> filterTypes;

  @Inject
  public OpenTsdbDiscoveryClient(
      OpenTsdbRestClient restClient, TagKeyCache tagKeyCache, PanelQueryServiceConfig config) {
    this.restClient = restClient;
    this.tagKeyCache = tagKeyCache;
    this.lookupLimit = config.getOpenTsdbConfig().getLookupLimit();
    this.aggregators = get(AGGREGATORS_PATH, Map.of()).map(this::sortedValues).cache();
    this.filterTypes = get(FILTERS_PATH, Map.of()).map(this::sortedFieldNames).cache();
  }

  public Single<List<String>> suggest(SuggestType type, String query) {
    return get(
            SUGGEST_PATH,
            ImmutableMap.of(
                "type", type.getValue(), "q", query, "max", String.valueOf(lookupLimit)))
        .map(this::values);
  }

  /** Distinct tag keys of every series of the metric, in the order they were first seen. */
  public Single<List<String>> lookupTagKeys(String metric) {
    if (StringUtils.isEmpty(metric)) {
      return Single.just(List.of());
    }
    Map<String, String> queryParameters =
        ImmutableMap.of("m", metric, "limit", String.valueOf(TAG_KEY_LOOKUP_LIMIT));
    return get(LOOKUP_PATH, queryParameters)
        .map(
            response -> {
              Set<String> tagKeys = new LinkedHashSet<>();
              for (JsonNode result : response.path("results")) {
                result.path("tags").fieldNames().forEachRemaining(tagKeys::add);
              }
              return List.copyOf(tagKeys);
            });
  }

  /**
   * Distinct values of the first of the comma separated {@code keys}. Any further keys narrow the
   * lookup and are passed along as given, e.g. {@code host, dc=eu}.
   */
  public Single<List<String>> lookupTagValues(String metric, String keys) {
    if (StringUtils.isEmpty(metric) || StringUtils.isEmpty(keys)) {
      return Single.just(List.of());
    }
    List<String> keyList =
        Arrays.stream(keys.split(",", -1)).map(String::trim).collect(Collectors.toList());
    String key = keyList.get(0);
    if (key.isEmpty()) {
      return Single.just(List.of());
    }
    StringBuilder keysQuery = new StringBuilder(key).append("=*");
    if (keyList.size() > 1) {
      keysQuery.append(',').append(String.join(",", keyList.subList(1, keyList.size())));
    }
    String lookupMetric = metric + "{" + keysQuery + "}";

    Map<String, String> queryParameters =
        ImmutableMap.of("m", lookupMetric, "limit", String.valueOf(lookupLimit));
    return get(LOOKUP_PATH, queryParameters)
        .map(
            response -> {
              Set<String> tagValues = new LinkedHashSet<>();
              for (JsonNode result : response.path("results")) {
                JsonNode value = result.path("tags").path(key);
                if (!value.isMissingNode()) {
                  tagValues.add(value.asText());
                }
              }
              return List.copyOf(tagValues);
            });
  }

  public Single<List<String>> aggregators() {
    return aggregators;
  }

  public Single<List<String>> filterTypes() {
    return filterTypes;
  }

  /** Tag keys cached from earlier query responses; no request is made. */
  public Single<List<String>> suggestTagKeys(String metric) {
    return Single.just(tagKeyCache.getTagKeys(metric));
  }

  public Single<Boolean> testConnection() {
    return suggest(SuggestType.METRICS, CONNECTION_TEST_QUERY)
        .map(suggestions -> true)
        .doOnError(error -> LOG.error("OpenTSDB connection test failed", error));
  }

  private Single<JsonNode> get(String path, Map<String, String> queryParameters) {
    return RxFutureUtil.toSingle(() -> restClient.getJson(path, queryParameters));
  }

  private List<String> values(JsonNode response) {
    List<String> values = new ArrayList<>();
    if (response.isArray()) {
      response.forEach(value -> values.add(value.asText()));
    }
    return values;
  }

  private List<String> sortedValues(JsonNode response) {
    List<String> values = values(response);
    Collections.sort(values);
    return values;
  }

  private List<String> sortedFieldNames(JsonNode response) {
    List<String> fieldNames = new ArrayList<>();
    if (response.isObject()) {
      response.fieldNames().forEachRemaining(fieldNames::add);
    }
    Collections.sort(fieldNames);
    return fieldNames;
  }
}
