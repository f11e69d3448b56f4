package org.sensepitch.ipgeo;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.model.registry.Collector;
import io.prometheus.metrics.model.snapshots.GaugeSnapshot;
import io.prometheus.metrics.model.snapshots.Labels;
import io.prometheus.metrics.model.snapshots.Unit;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Service metrics. Instances are usable without registration, so tests can inspect the counters
 * directly.
 *
 * @author Jens Wilke
 */
public class GeoMetrics implements HasMultipleMetrics {

  public static final String RELOAD_SUCCESS = "success";
  public static final String RELOAD_FAILURE = "failure";

  private final Clock clock;

  private volatile DatabaseSnapshot snapshot;

  final Counter requests =
      Counter.builder()
          .name("ipgeo_requests")
          .help("Completed API requests by endpoint and status code")
          .labelNames("endpoint", "status")
          .build();

  final Histogram requestDuration =
      Histogram.builder()
          .name("ipgeo_request_duration_seconds")
          .help("Duration from request received until the response is written")
          .unit(Unit.SECONDS)
          .labelNames("endpoint")
          .classicExponentialUpperBounds(0.0005, 2.0, 14)
          .build();

  final Counter lookups =
      Counter.builder()
          .name("ipgeo_lookups")
          .help("Address lookups by the source of the placement: region, city or none")
          .labelNames("placement")
          .build();

  final Counter reloads =
      Counter.builder()
          .name("ipgeo_snapshot_reloads")
          .help("Database snapshot loads by outcome")
          .labelNames("outcome")
          .build();

  final Counter ingressErrors =
      Counter.builder()
          .name("ipgeo_ingress_error")
          .help("Exceptions in the connection pipeline by type")
          .labelNames("type")
          .build();

  public GeoMetrics() {
    this(Clock.systemUTC());
  }

  public GeoMetrics(Clock clock) {
    this.clock = clock;
  }

  public void requestCompleted(String endpoint, int status, long durationNanos) {
    requests.labelValues(endpoint, Integer.toString(status)).inc();
    requestDuration.labelValues(endpoint).observe(Unit.nanosToSeconds(durationNanos));
  }

  public void lookupCompleted(String placementSource) {
    lookups.labelValues(placementSource).inc();
  }

  public void snapshotPublished(DatabaseSnapshot snapshot) {
    this.snapshot = snapshot;
    reloads.labelValues(RELOAD_SUCCESS).inc();
  }

  public void snapshotFailed() {
    reloads.labelValues(RELOAD_FAILURE).inc();
  }

  public void ingressError(String type) {
    ingressErrors.labelValues(type).inc();
  }

  @Override
  public void registerCollectors(Consumer<Collector> consumer) {
    consumer.accept(requests);
    consumer.accept(requestDuration);
    consumer.accept(lookups);
    consumer.accept(reloads);
    consumer.accept(ingressErrors);
    consumer.accept(
        () ->
            GaugeSnapshot.builder()
                .name("ipgeo_snapshot_generation")
                .help("Generation of the live database snapshot, 0 if none is loaded")
                .dataPoint(
                    GaugeSnapshot.GaugeDataPointSnapshot.builder()
                        .value(snapshot == null ? 0 : snapshot.generation())
                        .labels(Labels.EMPTY)
                        .build())
                .build());
    consumer.accept(
        () ->
            GaugeSnapshot.builder()
                .name("ipgeo_snapshot_age_seconds")
                .help("Seconds since the live database snapshot was loaded")
                .unit(Unit.SECONDS)
                .dataPoint(
                    GaugeSnapshot.GaugeDataPointSnapshot.builder()
                        .value(snapshotAgeSeconds())
                        .labels(Labels.EMPTY)
                        .build())
                .build());
  }

  double snapshotAgeSeconds() {
    DatabaseSnapshot current = snapshot;
    if (current == null || current.loadedAt() == null) {
      return 0;
    }
    return Duration.between(current.loadedAt(), clock.instant()).toMillis() / 1000.0;
  }
}
