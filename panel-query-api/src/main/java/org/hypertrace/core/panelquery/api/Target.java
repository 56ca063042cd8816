package org.hypertrace.core.panelquery.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One query row of a dashboard panel, as stored in the dashboard model. Fields are loosely typed
 * on purpose: rate counters arrive as text and most fields may be missing. Validation and
 * defaulting happen once, when the target is normalized.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Target {
  public static final String QUERY_TYPE_METRIC = "metric";
  public static final String QUERY_TYPE_GEXP = "gexp";

  @JsonProperty("refId")
  String refId;

  @JsonProperty("queryType")
  String queryType;

  @JsonProperty("metric")
  String metric;

  @JsonProperty("aggregator")
  String aggregator;

  @JsonProperty("tags")
  @Singular(ignoreNullCollections = true)
  Map<String, String> tags;

  @JsonProperty("filters")
  @Singular(ignoreNullCollections = true)
  List<TagFilter> filters;

  @JsonProperty("disableDownsampling")
  boolean disableDownsampling;

  @JsonProperty("downsampleInterval")
  String downsampleInterval;

  @JsonProperty("downsampleAggregator")
  String downsampleAggregator;

  @JsonProperty("downsampleFillPolicy")
  String downsampleFillPolicy;

  @JsonProperty("shouldComputeRate")
  boolean shouldComputeRate;

  @JsonProperty("isCounter")
  boolean counter;

  @JsonProperty("counterMax")
  String counterMax;

  @JsonProperty("counterResetValue")
  String counterResetValue;

  @JsonProperty("explicitTags")
  boolean explicitTags;

  @JsonProperty("alias")
  String alias;

  @JsonProperty("gexp")
  String gexp;

  @JsonProperty("gexpAlias")
  String gexpAlias;

  @JsonProperty("hide")
  boolean hide;
}
