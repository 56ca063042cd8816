package org.hypertrace.core.panelquery.opentsdb;

import java.util.List;
import lombok.Value;
import org.hypertrace.core.panelquery.api.RawSeries;

/** Joined outcome of every call made for one panel evaluation. */
@Value
public class DispatchResult {
  /** Empty when no batch call was made. */
  List<RawSeries> batchSeries;

  /** In request order, which says nothing about which target each one belongs to. */
  List<ExpressionResponse> expressionResponses;
}
