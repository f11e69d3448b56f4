package org.sensepitch.ipgeo;

import lombok.Builder;

/**
 * @param enable start the Prometheus exporter, default {@code true}
 * @param port port of the Prometheus exporter, default {@value #DEFAULT_PORT}
 * @author Jens Wilke
 */
@Builder(toBuilder = true)
public record MetricsConfig(Boolean enable, int port) {

  public static final int DEFAULT_PORT = 9464;

  public static final MetricsConfig DEFAULT = MetricsConfig.builder().build();

  public MetricsConfig {
    enable = enable == null ? Boolean.TRUE : enable;
    port = port == 0 ? DEFAULT_PORT : port;
  }
}
