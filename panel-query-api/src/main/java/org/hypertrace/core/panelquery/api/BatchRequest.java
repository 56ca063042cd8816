package org.hypertrace.core.panelquery.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Body of one {@code POST /api/query} call carrying every metric sub query of a panel. */
@Value
@Builder
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({"start", "end", "queries", "msResolution", "globalAnnotations", "showQuery"})
public class BatchRequest {
  @JsonProperty("start")
  long start;

  @JsonProperty("end")
  Long end;

  @NonNull
  @Singular
  @JsonProperty("queries")
  List<MetricQuery> queries;

  @JsonProperty("msResolution")
  boolean msResolution;

  @JsonProperty("globalAnnotations")
  boolean globalAnnotations;

  /** Only set against version 3 backends, which then echo the origin index of every series. */
  @JsonProperty("showQuery")
  Boolean showQuery;
}
