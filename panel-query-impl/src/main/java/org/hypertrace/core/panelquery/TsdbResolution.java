package org.hypertrace.core.panelquery;

import java.util.Arrays;

/** Timestamp resolution OpenTSDB is asked to return datapoints in. */
public enum TsdbResolution {
  SECOND(1, 1000L),
  MILLISECOND(2, 1L);

  private final int code;
  private final long toMillisFactor;

  TsdbResolution(int code, long toMillisFactor) {
    this.code = code;
    this.toMillisFactor = toMillisFactor;
  }

  public long getToMillisFactor() {
    return toMillisFactor;
  }

  public static TsdbResolution fromCode(int code) {
    return Arrays.stream(values())
        .filter(resolution -> resolution.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown tsdb resolution: " + code));
  }
}
