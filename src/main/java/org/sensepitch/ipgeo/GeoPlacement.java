package org.sensepitch.ipgeo;

import java.util.List;
import lombok.Builder;

/**
 * Geographic and administrative placement of an address, produced by exactly one source per
 * lookup. All fields may be {@code null}, the region lists are never {@code null} but may be empty.
 *
 * @param regions region names from the country level down to the most specific, e.g. province,
 *     city
 * @param regionCodes abbreviation for each entry in {@code regions}
 * @param category network use category, e.g. "datacenter" or "broadband"
 */
@Builder(toBuilder = true)
public record GeoPlacement(
    Double latitude,
    Double longitude,
    Country country,
    Country registeredCountry,
    List<String> regions,
    List<String> regionCodes,
    String category) {

  public GeoPlacement {
    regions = regions == null ? List.of() : List.copyOf(regions);
    regionCodes = regionCodes == null ? List.of() : List.copyOf(regionCodes);
  }

  public boolean hasLocation() {
    return latitude != null && longitude != null;
  }
}
