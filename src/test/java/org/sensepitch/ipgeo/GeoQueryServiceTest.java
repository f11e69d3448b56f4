package org.sensepitch.ipgeo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

/**
 * @author Jens Wilke
 */
class GeoQueryServiceTest {

  private final GeoMetrics metrics = new GeoMetrics();
  private final CompletableFuture<List<Address>> ipv4Answer = new CompletableFuture<>();

  private final AddressQuery query =
      (hostname, type) ->
          type == RecordType.A ? ipv4Answer : CompletableFuture.completedFuture(List.of());

  /** The second generation has no city table. */
  private final SnapshotLoader loader =
      generation ->
          generation == 1
              ? TestSnapshots.snapshot(generation)
              : new DatabaseSnapshot(
                  TestSnapshots.asnTable(),
                  new InMemoryPrefixTable<>(),
                  TestSnapshots.regionTable(),
                  "CN",
                  null,
                  Instant.now(),
                  generation,
                  null);

  private final SnapshotManager snapshots = new SnapshotManager(loader, metrics);

  private final GeoQueryService service =
      new GeoQueryService(
          new HostClassifier(),
          new HostnameResolver(query, Duration.ofSeconds(5)),
          snapshots,
          new GeoLookup(metrics));

  @Test
  void literal_singleRecord() {
    snapshots.start();
    ResolutionResult result = service.query(" 8.8.8.8 ").join();
    assertThat(result.literal()).isTrue();
    assertThat(result.host()).isEqualTo("8.8.8.8");
    assertThat(result.records()).hasSize(1);
    assertThat(result.records().get(0).placement()).isEqualTo(TestSnapshots.MOUNTAIN_VIEW);
  }

  @Test
  void hostname_recordPerAddress() {
    snapshots.start();
    ipv4Answer.complete(List.of(Address.parse("8.8.8.8"), Address.parse("1.2.3.4")));
    ResolutionResult result = service.query("Dns.Google.").join();
    assertThat(result.literal()).isFalse();
    assertThat(result.host()).isEqualTo("dns.google");
    assertThat(result.records())
        .extracting(r -> r.address().toString())
        .containsExactly("8.8.8.8", "1.2.3.4");
  }

  @Test
  void snapshotCapturedOnce_reloadDuringResolution() {
    snapshots.start();
    CompletableFuture<ResolutionResult> pending = service.query("dns.google");
    snapshots.reload();
    ipv4Answer.complete(List.of(Address.parse("8.8.8.8")));
    GeoRecord record = pending.join().records().get(0);
    assertThat(record.placement()).isEqualTo(TestSnapshots.MOUNTAIN_VIEW);
    assertThat(service.query("8.8.8.8").join().records().get(0).placement()).isNull();
  }

  @Test
  void invalidHost_failedFuture() {
    snapshots.start();
    assertThatThrownBy(() -> service.query("exa mple.com").join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(InvalidHostException.class);
  }

  @Test
  void notLoaded_unavailable() {
    assertThatThrownBy(() -> service.query("8.8.8.8").join())
        .hasCauseInstanceOf(DatabaseUnavailableException.class);
  }

  @Test
  void queryAddress() {
    snapshots.start();
    ResolutionResult result = service.queryAddress(Address.parse("2001:4860::8888"));
    assertThat(result.host()).isEqualTo("2001:4860::8888");
    assertThat(result.records().get(0).asn().number()).isEqualTo(15169);
  }
}
