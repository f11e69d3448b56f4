package org.sensepitch.ipgeo;

import java.util.List;

/**
 * Result of one query.
 *
 * @param host the host as requested
 * @param literal {@code true} if the host was an IP literal or the client address, which selects
 *     the single address response shape
 * @param records one record per address in resolver order
 */
public record ResolutionResult(String host, boolean literal, List<GeoRecord> records) {

  public ResolutionResult {
    records = List.copyOf(records);
  }
}
