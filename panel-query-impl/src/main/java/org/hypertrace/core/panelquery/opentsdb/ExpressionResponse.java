package org.hypertrace.core.panelquery.opentsdb;

import java.util.List;
import java.util.Optional;
import lombok.Value;
import org.hypertrace.core.panelquery.api.RawSeries;

/** Series of one expression call, with the {@code gexpIndex} read back from its request url. */
@Value
public class ExpressionResponse {
  Integer echoedIndex;
  List<RawSeries> series;

  public Optional<Integer> getEchoedIndex() {
    return Optional.ofNullable(echoedIndex);
  }
}
