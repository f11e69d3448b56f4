package org.sensepitch.ipgeo;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a hostname to its addresses. The A and AAAA queries run concurrently and both are
 * awaited. One failing query is tolerated, the result is deduplicated with A addresses before AAAA
 * addresses. Each query is bounded by the timeout, a timed out query counts as failed. No retries.
 *
 * @author Jens Wilke
 */
@Slf4j
public class HostnameResolver {

  private final AddressQuery query;
  private final Duration timeout;

  public HostnameResolver(AddressQuery query, Duration timeout) {
    this.query = query;
    this.timeout = timeout;
  }

  /**
   * @return future of the addresses, completing exceptionally with {@link NoSuchHostException} if
   *     no address was found
   */
  public CompletableFuture<List<Address>> resolve(Hostname hostname) {
    CompletableFuture<List<Address>> a = bounded(hostname, RecordType.A);
    CompletableFuture<List<Address>> aaaa = bounded(hostname, RecordType.AAAA);
    return a.thenCombine(aaaa, (v4, v6) -> merge(hostname, v4, v6));
  }

  /** Query with timeout, a failure yields {@code null} so the other query is still awaited. */
  private CompletableFuture<List<Address>> bounded(Hostname hostname, RecordType type) {
    CompletableFuture<List<Address>> future;
    try {
      future = query.lookup(hostname, type);
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    return future
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(
            ex -> {
              log.debug(type + " query for " + hostname + " failed: " + ex);
              return null;
            });
  }

  private static List<Address> merge(Hostname hostname, List<Address> v4, List<Address> v6) {
    if (v4 == null && v6 == null) {
      throw new NoSuchHostException("Cannot resolve " + hostname);
    }
    Set<Address> addresses = new LinkedHashSet<>();
    if (v4 != null) {
      addresses.addAll(v4);
    }
    if (v6 != null) {
      addresses.addAll(v6);
    }
    if (addresses.isEmpty()) {
      throw new NoSuchHostException("No address records for " + hostname);
    }
    return new ArrayList<>(addresses);
  }
}
