package org.hypertrace.core.panelquery;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import org.hypertrace.core.panelquery.api.TemplateInterpolator;
import org.hypertrace.core.panelquery.discovery.MetricFindQueryResolver;
import org.hypertrace.core.panelquery.discovery.OpenTsdbDiscoveryClient;

/**
 * Entry point for hosts embedding the panel query service. Every factory owns its own injector,
 * and with it its own http client and tag key cache.
 */
public class PanelQueryServiceFactory {
  private static final String PANEL_QUERY_CONFIG = "panel.query";

  private final Injector injector;

  /** @param config root config, read from its {@code panel.query} block when present */
  public PanelQueryServiceFactory(Config config) {
    this(new PanelQueryModule(panelQueryConfig(config)));
  }

  public PanelQueryServiceFactory(
      Config config, TemplateInterpolator templateInterpolator, MeterRegistry meterRegistry) {
    this(new PanelQueryModule(panelQueryConfig(config), templateInterpolator, meterRegistry));
  }

  private PanelQueryServiceFactory(PanelQueryModule module) {
    this.injector = Guice.createInjector(module);
  }

  public PanelQueryHandler getQueryHandler() {
    return injector.getInstance(PanelQueryHandler.class);
  }

  public OpenTsdbDiscoveryClient getDiscoveryClient() {
    return injector.getInstance(OpenTsdbDiscoveryClient.class);
  }

  public MetricFindQueryResolver getMetricFindQueryResolver() {
    return injector.getInstance(MetricFindQueryResolver.class);
  }

  private static Config panelQueryConfig(Config config) {
    return config.hasPath(PANEL_QUERY_CONFIG) ? config.getConfig(PANEL_QUERY_CONFIG) : config;
  }
}
