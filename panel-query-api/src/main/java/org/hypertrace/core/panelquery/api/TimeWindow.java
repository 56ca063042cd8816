package org.hypertrace.core.panelquery.api;

import com.google.common.base.Preconditions;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Query time range in epoch millis. An absent end means the window is relative to now, and the
 * backend is left to read it as "through now".
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeWindow {
  long startMs;
  Long endMs;

  public static TimeWindow since(long startMs) {
    return new TimeWindow(startMs, null);
  }

  public static TimeWindow between(long startMs, long endMs) {
    Preconditions.checkArgument(
        endMs >= startMs, "end %s must not be before start %s", endMs, startMs);
    return new TimeWindow(startMs, endMs);
  }

  public Optional<Long> getEnd() {
    return Optional.ofNullable(endMs);
  }
}
