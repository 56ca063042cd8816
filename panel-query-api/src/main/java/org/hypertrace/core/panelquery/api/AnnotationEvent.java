package org.hypertrace.core.panelquery.api;

import lombok.Value;

@Value
public class AnnotationEvent {
  String text;
  long timeMs;
}
