package org.hypertrace.core.panelquery.reconcile;

import lombok.Value;
import org.hypertrace.core.panelquery.api.RawSeries;
import org.hypertrace.core.panelquery.normalize.NormalizedTarget;

/** A response row paired with the target it was attributed to. */
@Value
public class ReconciledRow<T extends NormalizedTarget> {
  RawSeries series;
  T target;
}
