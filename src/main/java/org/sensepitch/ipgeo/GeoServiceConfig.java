package org.sensepitch.ipgeo;

import lombok.Builder;

/**
 * Root of the service configuration, read from YAML or from environment variables prefixed with
 * {@value #ENV_PREFIX}.
 *
 * @author Jens Wilke
 */
@Builder(toBuilder = true)
public record GeoServiceConfig(
    ListenConfig listen, DatabaseConfig database, ResolverConfig resolver, MetricsConfig metrics) {

  public static final String ENV_PREFIX = "IPGEO_";

  public static final GeoServiceConfig DEFAULT = GeoServiceConfig.builder().build();

  public GeoServiceConfig {
    listen = listen == null ? ListenConfig.DEFAULT : listen;
    database = database == null ? DatabaseConfig.DEFAULT : database;
    resolver = resolver == null ? ResolverConfig.DEFAULT : resolver;
    metrics = metrics == null ? MetricsConfig.DEFAULT : metrics;
  }
}
