package org.sensepitch.ipgeo;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Answers a query: classify the input, resolve hostnames, look up every address. The snapshot is
 * captured once per query, so all records of a result come from the same snapshot even when a
 * reload happens while the hostname is resolved.
 *
 * @author Jens Wilke
 */
public class GeoQueryService {

  private final HostClassifier classifier;
  private final HostnameResolver resolver;
  private final SnapshotManager snapshots;
  private final GeoLookup lookup;

  public GeoQueryService(
      HostClassifier classifier,
      HostnameResolver resolver,
      SnapshotManager snapshots,
      GeoLookup lookup) {
    this.classifier = classifier;
    this.resolver = resolver;
    this.snapshots = snapshots;
    this.lookup = lookup;
  }

  /**
   * @return the result, or a future failing with {@link InvalidHostException}, {@link
   *     NoSuchHostException} or {@link DatabaseUnavailableException}
   */
  public CompletableFuture<ResolutionResult> query(String rawHost) {
    QueryTarget target;
    DatabaseSnapshot snapshot;
    try {
      target = classifier.classify(rawHost);
      snapshot = snapshots.current();
    } catch (GeoServiceException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (target instanceof Address address) {
      return CompletableFuture.completedFuture(
          lookupLiteral(rawHost.trim(), address, snapshot));
    }
    Hostname hostname = (Hostname) target;
    return resolver
        .resolve(hostname)
        .thenApply(
            addresses -> {
              List<GeoRecord> records = new ArrayList<>();
              for (Address address : addresses) {
                records.add(lookup.lookup(address, snapshot));
              }
              return new ResolutionResult(hostname.name(), false, records);
            });
  }

  /** Query for an address known to be valid, e.g. the client address. */
  public ResolutionResult queryAddress(Address address) {
    return lookupLiteral(address.toString(), address, snapshots.current());
  }

  private ResolutionResult lookupLiteral(
      String host, Address address, DatabaseSnapshot snapshot) {
    return new ResolutionResult(host, true, List.of(lookup.lookup(address, snapshot)));
  }
}
