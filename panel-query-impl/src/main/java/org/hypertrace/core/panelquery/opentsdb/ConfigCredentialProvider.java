package org.hypertrace.core.panelquery.opentsdb;

import java.util.Optional;
import javax.inject.Inject;
import okhttp3.Credentials;
import org.hypertrace.core.panelquery.PanelQueryServiceConfig;

/** Basic auth credentials taken from the {@code opentsdb.basicAuth} config block. */
public class ConfigCredentialProvider implements CredentialProvider {

  private final Optional<String> authorization;

  @Inject
  public ConfigCredentialProvider(PanelQueryServiceConfig config) {
    this.authorization =
        config
            .getOpenTsdbConfig()
            .getBasicAuth()
            .map(basicAuth -> Credentials.basic(basicAuth.getUser(), basicAuth.getPassword()));
  }

  @Override
  public Optional<String> getAuthorization() {
    return authorization;
  }
}
