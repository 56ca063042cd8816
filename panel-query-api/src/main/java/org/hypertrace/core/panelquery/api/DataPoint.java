package org.hypertrace.core.panelquery.api;

import lombok.Value;

@Value
public class DataPoint {
  long timestamp;
  Double value;
}
