package org.hypertrace.core.panelquery.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TargetTest {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @Test
  public void testDeserializeDashboardTarget() throws Exception {
    String json =
        "{\"refId\":\"A\",\"metric\":\"sys.cpu\",\"aggregator\":\"sum\","
            + "\"tags\":{\"host\":\"web1|web2\",\"dc\":\"*\"},"
            + "\"shouldComputeRate\":true,\"isCounter\":true,\"counterMax\":\"100\","
            + "\"downsampleInterval\":\"5m\",\"someFutureField\":1}";

    Target target = OBJECT_MAPPER.readValue(json, Target.class);

    assertEquals("A", target.getRefId());
    assertNull(target.getQueryType());
    assertEquals("sys.cpu", target.getMetric());
    assertEquals(List.of("host", "dc"), List.copyOf(target.getTags().keySet()));
    assertTrue(target.isShouldComputeRate());
    assertTrue(target.isCounter());
    assertEquals("100", target.getCounterMax());
    assertFalse(target.isHide());
    assertTrue(target.getFilters().isEmpty());
  }

  @Test
  public void testDeserializeNullCollections() throws Exception {
    Target target =
        OBJECT_MAPPER.readValue(
            "{\"queryType\":\"gexp\",\"gexp\":\"sum(x)\",\"tags\":null,\"filters\":null}",
            Target.class);

    assertEquals(Target.QUERY_TYPE_GEXP, target.getQueryType());
    assertTrue(target.getTags().isEmpty());
    assertTrue(target.getFilters().isEmpty());
  }

  @Test
  public void testDeserializeFilters() throws Exception {
    Target target =
        OBJECT_MAPPER.readValue(
            "{\"metric\":\"m\",\"filters\":[{\"type\":\"wildcard\",\"tagk\":\"host\","
                + "\"filter\":\"web*\",\"groupBy\":true}]}",
            Target.class);

    assertEquals(
        List.of(
            TagFilter.builder().type("wildcard").tagk("host").filter("web*").groupBy(true).build()),
        target.getFilters());
  }
}
