package org.sensepitch.ipgeo;

import com.maxmind.db.MaxMindDbConstructor;
import com.maxmind.db.MaxMindDbParameter;
import com.maxmind.db.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Global city table, e.g. GeoLite2-City. Yields the baseline placement with country, registered
 * country, coordinates and, as regions, the first subdivision and the city.
 *
 * @author Jens Wilke
 */
public class CityTable extends MaxMindTable<CityTable.CityEntry, GeoPlacement> {

  private final RegionNames names;

  public CityTable(Reader reader, RegionNames names) {
    super(TableKind.CITY, reader, CityEntry.class);
    this.names = names;
  }

  @Override
  protected GeoPlacement convert(CityEntry entry) {
    List<String> regions = new ArrayList<>();
    List<String> regionCodes = new ArrayList<>();
    if (entry.subdivisions != null && !entry.subdivisions.isEmpty()) {
      Area province = entry.subdivisions.get(0);
      String name = names.pick(province.names);
      if (name != null) {
        regions.add(RegionNames.provinceName(name));
        regionCodes.add(RegionNames.abbreviate(name, province.isoCode));
      }
    }
    if (entry.city != null) {
      String name = names.pick(entry.city.names);
      if (name != null) {
        regions.add(RegionNames.cityName(name));
        regionCodes.add(RegionNames.abbreviate(name, null));
      }
    }
    GeoPlacement placement =
        GeoPlacement.builder()
            .country(country(entry.country))
            .registeredCountry(country(entry.registeredCountry))
            .latitude(entry.location != null ? entry.location.latitude : null)
            .longitude(entry.location != null ? entry.location.longitude : null)
            .regions(regions)
            .regionCodes(regionCodes)
            .build();
    if (placement.country() == null
        && placement.registeredCountry() == null
        && !placement.hasLocation()
        && regions.isEmpty()) {
      return null;
    }
    return placement;
  }

  private Country country(Area area) {
    if (area == null) {
      return null;
    }
    String name = names.pick(area.names);
    if (name == null && area.isoCode == null) {
      return null;
    }
    return new Country(area.isoCode, name);
  }

  public static class CityEntry {

    final Area city;
    final Area country;
    final Area registeredCountry;
    final List<Area> subdivisions;
    final Location location;

    @MaxMindDbConstructor
    public CityEntry(
        @MaxMindDbParameter(name = "city") Area city,
        @MaxMindDbParameter(name = "country") Area country,
        @MaxMindDbParameter(name = "registered_country") Area registeredCountry,
        @MaxMindDbParameter(name = "subdivisions") List<Area> subdivisions,
        @MaxMindDbParameter(name = "location") Location location) {
      this.city = city;
      this.country = country;
      this.registeredCountry = registeredCountry;
      this.subdivisions = subdivisions;
      this.location = location;
    }
  }

  /** Country, subdivision or city with its localized names. */
  public static class Area {

    final String isoCode;
    final Map<String, String> names;

    @MaxMindDbConstructor
    public Area(
        @MaxMindDbParameter(name = "iso_code") String isoCode,
        @MaxMindDbParameter(name = "names") Map<String, String> names) {
      this.isoCode = isoCode;
      this.names = names;
    }
  }

  public static class Location {

    final Double latitude;
    final Double longitude;

    @MaxMindDbConstructor
    public Location(
        @MaxMindDbParameter(name = "latitude") Double latitude,
        @MaxMindDbParameter(name = "longitude") Double longitude) {
      this.latitude = latitude;
      this.longitude = longitude;
    }
  }
}
