package org.hypertrace.core.panelquery.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/** An OpenTSDB tag filter, e.g. {@code {type: "literal_or", tagk: "host", filter: "a|b"}}. */
@Value
@With
@Jacksonized
@Builder
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({"type", "tagk", "filter", "groupBy"})
@JsonIgnoreProperties(ignoreUnknown = true)
public class TagFilter {
  @JsonProperty("type")
  String type;

  @JsonProperty("tagk")
  String tagk;

  @JsonProperty("filter")
  String filter;

  @JsonProperty("groupBy")
  boolean groupBy;
}
