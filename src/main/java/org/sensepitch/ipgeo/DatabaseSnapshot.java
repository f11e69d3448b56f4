package org.sensepitch.ipgeo;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable bundle of the loaded tables. A lookup captures one snapshot and uses it for all
 * tables, a reload publishes a new snapshot as a whole.
 *
 * @param regionCountry ISO code of the country the region table covers
 * @param generation sequence number, incremented with each published snapshot
 * @param fingerprint state of the files the snapshot was loaded from
 * @author Jens Wilke
 */
public record DatabaseSnapshot(
    PrefixTable<AsnRecord> asnTable,
    PrefixTable<GeoPlacement> cityTable,
    PrefixTable<GeoPlacement> regionTable,
    String regionCountry,
    AsnCatalog asnCatalog,
    Instant loadedAt,
    long generation,
    DatabaseFiles.Fingerprint fingerprint) {

  public DatabaseSnapshot {
    regionCountry = regionCountry == null ? null : regionCountry.toUpperCase(Locale.ROOT);
    asnCatalog = asnCatalog == null ? AsnCatalog.EMPTY : asnCatalog;
    fingerprint = fingerprint == null ? DatabaseFiles.Fingerprint.NONE : fingerprint;
  }

  /** True if the region table should be consulted for addresses placed in the country. */
  public boolean coversRegion(Country country) {
    return regionTable != null
        && regionCountry != null
        && country != null
        && country.code() != null
        && regionCountry.equalsIgnoreCase(country.code());
  }

  @Override
  public String toString() {
    return "DatabaseSnapshot{generation="
        + generation
        + ", loadedAt="
        + loadedAt
        + ", asn="
        + asnTable
        + ", city="
        + cityTable
        + ", region="
        + regionTable
        + ", asnCatalog="
        + asnCatalog.size()
        + "}";
  }
}
