package org.hypertrace.core.panelquery.api;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** A template variable binding. A multi-value variable carries more than one value. */
@Value
@Builder
public class ScopedVariable {
  String text;
  @Singular List<String> values;

  public static ScopedVariable of(String value) {
    return ScopedVariable.builder().text(value).value(value).build();
  }

  public static ScopedVariable ofValues(List<String> values) {
    return ScopedVariable.builder().text(String.join(" + ", values)).values(values).build();
  }
}
