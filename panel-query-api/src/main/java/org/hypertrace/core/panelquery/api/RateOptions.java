package org.hypertrace.core.panelquery.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({"counter", "counterMax", "resetValue", "dropResets"})
public class RateOptions {
  @JsonProperty("counter")
  boolean counter;

  @JsonProperty("counterMax")
  Long counterMax;

  @JsonProperty("resetValue")
  Long resetValue;

  @JsonProperty("dropResets")
  boolean dropResets;
}
