package org.hypertrace.core.panelquery.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single sub query of an OpenTSDB {@code /api/query} body. Unset optional fields are left out of
 * the serialized form entirely.
 */
@Value
@Builder
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({
  "metric",
  "aggregator",
  "downsample",
  "rate",
  "rateOptions",
  "tags",
  "filters",
  "explicitTags"
})
public class MetricQuery {
  @NonNull
  @JsonProperty("metric")
  String metric;

  @NonNull
  @JsonProperty("aggregator")
  String aggregator;

  @JsonProperty("downsample")
  String downsample;

  @JsonProperty("rate")
  Boolean rate;

  @JsonProperty("rateOptions")
  RateOptions rateOptions;

  @JsonProperty("tags")
  Map<String, String> tags;

  @JsonProperty("filters")
  List<TagFilter> filters;

  @JsonProperty("explicitTags")
  Boolean explicitTags;

  public boolean hasFilters() {
    return filters != null && !filters.isEmpty();
  }
}
