package org.sensepitch.ipgeo;

import io.prometheus.metrics.model.registry.Collector;
import java.util.function.Consumer;

/**
 * Component exposing a set of Prometheus collectors.
 *
 * @author Jens Wilke
 */
public interface HasMultipleMetrics {

  void registerCollectors(Consumer<Collector> consumer);
}
