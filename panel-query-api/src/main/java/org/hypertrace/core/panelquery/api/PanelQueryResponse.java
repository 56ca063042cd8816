package org.hypertrace.core.panelquery.api;

import java.util.List;
import lombok.Value;

@Value
public class PanelQueryResponse {
  public static final PanelQueryResponse EMPTY = new PanelQueryResponse(List.of());

  List<ReconciledSeries> series;
}
