package org.sensepitch.ipgeo;

import com.maxmind.db.MaxMindDbConstructor;
import com.maxmind.db.MaxMindDbParameter;
import com.maxmind.db.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Region specific precision table covering one country, e.g. GeoCN for China. Entries carry
 * province, city and district names plus the network type, which becomes the placement category.
 * Country fields are left empty, the lookup carries them over from the city table.
 *
 * @author Jens Wilke
 */
public class RegionTable extends MaxMindTable<RegionTable.RegionEntry, GeoPlacement> {

  public RegionTable(Reader reader) {
    super(TableKind.REGION, reader, RegionEntry.class);
  }

  @Override
  protected GeoPlacement convert(RegionEntry entry) {
    List<String> regions = new ArrayList<>();
    List<String> regionCodes = new ArrayList<>();
    if (!isBlank(entry.province)) {
      regions.add(RegionNames.provinceName(entry.province));
      regionCodes.add(RegionNames.abbreviate(entry.province));
    }
    if (!isBlank(entry.city)) {
      regions.add(RegionNames.cityName(entry.city));
      regionCodes.add(RegionNames.abbreviate(entry.city));
    }
    if (!isBlank(entry.districts)) {
      regions.add(entry.districts);
      regionCodes.add(RegionNames.abbreviate(entry.districts));
    }
    String category = isBlank(entry.net) ? null : entry.net;
    if (regions.isEmpty() && category == null) {
      return null;
    }
    return GeoPlacement.builder()
        .regions(regions)
        .regionCodes(regionCodes)
        .category(category)
        .build();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  public static class RegionEntry {

    final String province;
    final String city;
    final String districts;
    final String net;

    @MaxMindDbConstructor
    public RegionEntry(
        @MaxMindDbParameter(name = "province") String province,
        @MaxMindDbParameter(name = "city") String city,
        @MaxMindDbParameter(name = "districts") String districts,
        @MaxMindDbParameter(name = "net") String net) {
      this.province = province;
      this.city = city;
      this.districts = districts;
      this.net = net;
    }
  }
}
