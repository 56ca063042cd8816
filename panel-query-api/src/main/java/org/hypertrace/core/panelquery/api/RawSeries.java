package org.hypertrace.core.panelquery.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A series as returned by OpenTSDB. Datapoints stay keyed by their raw timestamp text because its
 * resolution depends on how the datasource is configured.
 */
@Value
@Builder
public class RawSeries {
  @NonNull String metric;
  @Singular Map<String, String> tags;
  @Singular List<String> aggregateTags;

  /** Timestamp text to value. A null value is a gap produced by the {@code null} fill policy. */
  @Singular("dp") Map<String, Double> dps;

  /** Origin index of the sub query, only echoed by version 3 backends. */
  Integer queryIndex;

  @Singular List<Annotation> annotations;
  @Singular List<Annotation> globalAnnotations;

  public Optional<Integer> getQueryIndex() {
    return Optional.ofNullable(queryIndex);
  }
}
