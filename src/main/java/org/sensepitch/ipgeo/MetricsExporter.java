package org.sensepitch.ipgeo;

import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;

/**
 * Exposes the service and JVM metrics in Prometheus format on a separate port.
 *
 * @author Jens Wilke
 */
@Slf4j
public class MetricsExporter implements AutoCloseable {

  private final PrometheusRegistry registry;
  private HTTPServer server;

  public MetricsExporter() {
    this(new PrometheusRegistry());
  }

  MetricsExporter(PrometheusRegistry registry) {
    this.registry = registry;
  }

  public MetricsExporter expose(HasMultipleMetrics metrics) {
    metrics.registerCollectors(registry::register);
    return this;
  }

  public void start(int port) throws IOException {
    JvmMetrics.builder().register(registry);
    server = HTTPServer.builder().port(port).registry(registry).buildAndStart();
    log.info("Prometheus metrics exposed on port " + server.getPort());
  }

  @Override
  public void close() {
    if (server != null) {
      server.close();
      server = null;
    }
  }
}
