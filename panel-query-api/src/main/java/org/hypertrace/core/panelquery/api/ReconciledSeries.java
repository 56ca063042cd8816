package org.hypertrace.core.panelquery.api;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** A series ready for rendering: its display label and points sorted by timestamp. */
@Value
@Builder
public class ReconciledSeries {
  @NonNull String label;
  @Singular List<DataPoint> datapoints;
  String refId;
}
