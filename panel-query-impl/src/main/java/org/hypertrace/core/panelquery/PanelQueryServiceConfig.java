package org.hypertrace.core.panelquery;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Optional;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class PanelQueryServiceConfig {

  private static final String CONFIG_PATH_DEFAULTS = "panel.query";
  private static final String CONFIG_PATH_OPENTSDB = "opentsdb";

  OpenTsdbConfig openTsdbConfig;

  public PanelQueryServiceConfig(Config config) {
    Config resolved =
        config.withFallback(ConfigFactory.defaultReference().getConfig(CONFIG_PATH_DEFAULTS))
            .resolve();
    this.openTsdbConfig = new OpenTsdbConfig(resolved.getConfig(CONFIG_PATH_OPENTSDB));
  }

  @Value
  @NonFinal
  public static class OpenTsdbConfig {
    private static final String CONFIG_PATH_URL = "url";
    private static final String CONFIG_PATH_VERSION = "version";
    private static final String CONFIG_PATH_RESOLUTION = "resolution";
    private static final String CONFIG_PATH_LOOKUP_LIMIT = "lookupLimit";
    private static final String CONFIG_PATH_REQUEST_TIMEOUT = "requestTimeout";
    private static final String CONFIG_PATH_BASIC_AUTH = "basicAuth";

    String url;
    int version;
    TsdbResolution resolution;
    int lookupLimit;
    Duration requestTimeout;
    Optional<BasicAuthConfig> basicAuth;

    private OpenTsdbConfig(Config config) {
      this.url = config.getString(CONFIG_PATH_URL);
      this.version = config.getInt(CONFIG_PATH_VERSION);
      this.resolution = TsdbResolution.fromCode(config.getInt(CONFIG_PATH_RESOLUTION));
      this.lookupLimit = config.getInt(CONFIG_PATH_LOOKUP_LIMIT);
      this.requestTimeout = config.getDuration(CONFIG_PATH_REQUEST_TIMEOUT);
      this.basicAuth =
          config.hasPath(CONFIG_PATH_BASIC_AUTH)
              ? Optional.of(new BasicAuthConfig(config.getConfig(CONFIG_PATH_BASIC_AUTH)))
              : Optional.empty();
    }

    /** Version 3 backends echo the origin index of every series when asked to. */
    public boolean isQueryIndexEchoed() {
      return version >= 3;
    }
  }

  @Value
  @NonFinal
  public static class BasicAuthConfig {
    private static final String CONFIG_PATH_USER = "user";
    private static final String CONFIG_PATH_PASSWORD = "password";
    String user;
    @ToString.Exclude String password;

    private BasicAuthConfig(Config config) {
      this.user = config.getString(CONFIG_PATH_USER);
      this.password = config.getString(CONFIG_PATH_PASSWORD);
    }
  }
}
