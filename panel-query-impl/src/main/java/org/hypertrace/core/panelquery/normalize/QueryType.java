package org.hypertrace.core.panelquery.normalize;

import java.util.Arrays;
import java.util.Optional;
import org.hypertrace.core.panelquery.api.Target;

public enum QueryType {
  METRIC(Target.QUERY_TYPE_METRIC),
  GEXP(Target.QUERY_TYPE_GEXP);

  private final String name;

  QueryType(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  static Optional<QueryType> fromName(String name) {
    return Arrays.stream(values()).filter(type -> type.name.equals(name)).findFirst();
  }
}
