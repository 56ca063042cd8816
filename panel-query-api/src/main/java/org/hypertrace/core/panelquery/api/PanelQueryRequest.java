package org.hypertrace.core.panelquery.api;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Everything needed to evaluate one panel refresh. */
@Value
@Builder
public class PanelQueryRequest {
  @Singular List<Target> targets;
  @NonNull TimeWindow window;
  @Singular Map<String, ScopedVariable> scopedVars;
}
