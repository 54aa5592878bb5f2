package com.dataexchange.exchangeapi.config;

import java.time.Instant;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.stereotype.Component;

/**
 * Name and build of the running service, resolved once at startup. Without build-info on the
 * classpath (IDE runs, tests) the version is {@value #UNKNOWN} and the build time is null.
 */
@Component
public class ServiceInfo {
  static final String DEFAULT_APP_NAME = "exchange-api";
  static final String UNKNOWN = "unknown";

  private final String applicationName;
  private final String version;
  private final Instant buildTime;

  public ServiceInfo(
      ObjectProvider<BuildProperties> buildPropertiesProvider,
      @Value("${spring.application.name:" + DEFAULT_APP_NAME + "}") String applicationName) {
    BuildProperties buildProperties = buildPropertiesProvider.getIfAvailable();
    this.applicationName = valueOrDefault(applicationName, DEFAULT_APP_NAME);
    this.version =
        buildProperties == null ? UNKNOWN : valueOrDefault(buildProperties.getVersion(), UNKNOWN);
    this.buildTime = buildProperties == null ? null : buildProperties.getTime();
  }

  public String applicationName() {
    return applicationName;
  }

  public String version() {
    return version;
  }

  public Instant buildTime() {
    return buildTime;
  }

  private static String valueOrDefault(String value, String defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return value;
  }
}
