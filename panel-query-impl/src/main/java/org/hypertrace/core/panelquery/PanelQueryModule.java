package org.hypertrace.core.panelquery;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import java.util.Map;
import javax.inject.Singleton;
import okhttp3.OkHttpClient;
import org.hypertrace.core.panelquery.api.TemplateInterpolator;
import org.hypertrace.core.panelquery.opentsdb.AuthorizationInterceptor;
import org.hypertrace.core.panelquery.opentsdb.ConfigCredentialProvider;
import org.hypertrace.core.panelquery.opentsdb.CredentialProvider;
import org.hypertrace.core.panelquery.reconcile.IndexedMetricReconciler;
import org.hypertrace.core.panelquery.reconcile.LegacyMetricReconciler;
import org.hypertrace.core.panelquery.reconcile.MetricSeriesReconciler;
import org.hypertrace.core.panelquery.template.ScopedVarsTemplateInterpolator;

public class PanelQueryModule extends AbstractModule {

  private final PanelQueryServiceConfig config;
  private final TemplateInterpolator templateInterpolator;
  private final MeterRegistry meterRegistry;

  public PanelQueryModule(Config config) {
    this(config, new ScopedVarsTemplateInterpolator(Map.of()), Metrics.globalRegistry);
  }

  public PanelQueryModule(
      Config config, TemplateInterpolator templateInterpolator, MeterRegistry meterRegistry) {
    this.config = new PanelQueryServiceConfig(config);
    this.templateInterpolator = templateInterpolator;
    this.meterRegistry = meterRegistry;
  }

  @Override
  protected void configure() {
    bind(PanelQueryServiceConfig.class).toInstance(this.config);
    bind(TemplateInterpolator.class).toInstance(this.templateInterpolator);
    bind(MeterRegistry.class).toInstance(this.meterRegistry);
    bind(CredentialProvider.class).to(ConfigCredentialProvider.class);
  }

  @Provides
  @Singleton
  OkHttpClient provideOkHttpClient(CredentialProvider credentialProvider) {
    return new OkHttpClient.Builder()
        .addInterceptor(new AuthorizationInterceptor(credentialProvider))
        .build();
  }

  @Provides
  @Singleton
  MetricSeriesReconciler provideMetricSeriesReconciler(
      IndexedMetricReconciler indexedMetricReconciler,
      LegacyMetricReconciler legacyMetricReconciler) {
    return config.getOpenTsdbConfig().isQueryIndexEchoed()
        ? indexedMetricReconciler
        : legacyMetricReconciler;
  }
}
