package org.hypertrace.core.panelquery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.hypertrace.core.panelquery.api.PanelQueryRequest;
import org.hypertrace.core.panelquery.api.PanelQueryResponse;
import org.hypertrace.core.panelquery.api.Target;
import org.hypertrace.core.panelquery.api.TimeWindow;
import org.hypertrace.core.panelquery.template.ScopedVarsTemplateInterpolator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PanelQueryServiceFactoryTest {

  private MockWebServer mockWebServer;

  @BeforeEach
  public void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
  }

  @AfterEach
  public void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  public void testFactoryWiresAWorkingHandler() {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .addHeader("Content-Type", "application/json")
            .setBody(
                "[{\"metric\":\"sys.cpu\",\"tags\":{\"host\":\"web01\"},\"dps\":{\"60\":1}}]"));
    PanelQueryServiceFactory factory =
        new PanelQueryServiceFactory(
            rootConfig(), new ScopedVarsTemplateInterpolator(Map.of()), new SimpleMeterRegistry());

    PanelQueryResponse response =
        factory
            .getQueryHandler()
            .handleRequest(
                PanelQueryRequest.builder()
                    .window(TimeWindow.since(0L))
                    .target(Target.builder().metric("sys.cpu").tag("host", "web01").build())
                    .build())
            .blockingGet();

    assertEquals(1, response.getSeries().size());
    assertEquals("sys.cpu{host=web01}", response.getSeries().get(0).getLabel());
    assertEquals(60000L, response.getSeries().get(0).getDatapoints().get(0).getTimestamp());
    assertEquals(
        List.of("host"), factory.getDiscoveryClient().suggestTagKeys("sys.cpu").blockingGet());
  }

  @Test
  public void testSingletonsPerFactory() {
    PanelQueryServiceFactory first = new PanelQueryServiceFactory(rootConfig());
    PanelQueryServiceFactory second = new PanelQueryServiceFactory(rootConfig());

    assertSame(first.getQueryHandler(), first.getQueryHandler());
    assertNotSame(first.getQueryHandler(), second.getQueryHandler());
    assertNotNull(first.getMetricFindQueryResolver());
  }

  private Config rootConfig() {
    return ConfigFactory.parseMap(
        Map.of("panel.query.opentsdb.url", mockWebServer.url("/").toString()));
  }
}
