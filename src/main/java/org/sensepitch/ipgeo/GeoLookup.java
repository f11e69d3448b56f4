package org.sensepitch.ipgeo;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;

/**
 * Looks up one address in the tables of one snapshot and merges the results. The ASN table
 * supplies operator and network, the city table the baseline placement. For addresses the city
 * table places in the country covered by the region table, a region table hit replaces the
 * baseline placement, keeping only country and registered country from the baseline.
 *
 * <p>A miss in any table is a valid result. Read or decoding errors of a table are logged and
 * count as miss.
 *
 * @author Jens Wilke
 */
@Slf4j
public class GeoLookup {

  public static final String SOURCE_REGION = "region";
  public static final String SOURCE_CITY = "city";
  public static final String SOURCE_NONE = "none";

  private final GeoMetrics metrics;

  public GeoLookup(GeoMetrics metrics) {
    this.metrics = metrics;
  }

  public GeoRecord lookup(Address address, DatabaseSnapshot snapshot) {
    AsnRecord asn = null;
    NetworkSpan network = null;
    PrefixMatch<AsnRecord> asnMatch = query(TableKind.ASN, snapshot.asnTable(), address);
    if (asnMatch != null) {
      asn = asnMatch.value();
      asn = asn.withCatalogEntry(snapshot.asnCatalog().get(asn.number()));
      network = asnMatch.network();
    }
    if (network == null) {
      network = ReservedRanges.find(address);
    }
    GeoPlacement placement = null;
    String source = SOURCE_NONE;
    PrefixMatch<GeoPlacement> cityMatch = query(TableKind.CITY, snapshot.cityTable(), address);
    if (cityMatch != null) {
      placement = cityMatch.value();
      source = SOURCE_CITY;
    }
    if (placement != null && snapshot.coversRegion(placement.country())) {
      PrefixMatch<GeoPlacement> regionMatch =
          query(TableKind.REGION, snapshot.regionTable(), address);
      if (regionMatch != null) {
        placement =
            regionMatch.value().toBuilder()
                .country(placement.country())
                .registeredCountry(placement.registeredCountry())
                .build();
        source = SOURCE_REGION;
      }
    }
    metrics.lookupCompleted(source);
    return new GeoRecord(address, asn, network, placement);
  }

  private static <T> PrefixMatch<T> query(
      TableKind kind, PrefixTable<T> table, Address address) {
    if (table == null) {
      return null;
    }
    try {
      return table.longestPrefixMatch(address);
    } catch (IOException | RuntimeException e) {
      log.warn("Lookup of " + address + " in " + kind.label() + " table failed: " + e);
      return null;
    }
  }
}
