package org.hypertrace.core.panelquery.api;

import lombok.Value;

/** An annotation attached to a series, with its start time in epoch seconds. */
@Value
public class Annotation {
  String description;
  double startTime;
}
