package org.hypertrace.core.panelquery.api;

import lombok.NonNull;
import lombok.Value;

/**
 * One {@code GET /api/query/gexp} call. The correlation index is sent as the {@code gexpIndex}
 * parameter and read back from the response's request url, since the expression response itself
 * has nothing to correlate on.
 */
@Value
public class ExpressionRequest {
  @NonNull TimeWindow window;
  @NonNull String expression;
  int correlationIndex;
}
