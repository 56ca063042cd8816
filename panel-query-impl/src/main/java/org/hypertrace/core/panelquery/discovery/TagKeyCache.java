package org.hypertrace.core.panelquery.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import org.hypertrace.core.panelquery.api.RawSeries;

/**
 * Tag keys last seen per metric in query responses. Entries are overwritten by every new
 * response, so a read may be stale or missing; it only ever feeds autocompletion.
 */
@Singleton
public class TagKeyCache {

  private final Map<String, List<String>> tagKeysByMetric = new ConcurrentHashMap<>();

  public void save(RawSeries series) {
    List<String> tagKeys = new ArrayList<>(series.getTags().keySet());
    tagKeys.addAll(series.getAggregateTags());
    tagKeysByMetric.put(series.getMetric(), List.copyOf(tagKeys));
  }

  public List<String> getTagKeys(String metric) {
    return tagKeysByMetric.getOrDefault(metric, List.of());
  }
}
