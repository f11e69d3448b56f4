package org.sensepitch.ipgeo;

import java.nio.file.Path;
import java.util.List;
import lombok.Builder;

/**
 * Location and handling of the database files. The files are replaced by an external updater,
 * which must write them atomically, e.g. write to a temporary file and rename.
 *
 * @param directory directory containing the database files, default {@value #DEFAULT_DIRECTORY}
 * @param asnFile ASN database file name, relative to {@code directory}
 * @param cityFile global city database file name
 * @param regionFile region specific database file name
 * @param regionCountry ISO country code covered by the region specific database
 * @param asnCatalogFile optional JSON file with localized ASN names and network types
 * @param languages preferred languages for names from the city database
 * @param reloadIntervalSeconds how often the files are checked for changes, default {@value
 *     #DEFAULT_RELOAD_INTERVAL_SECONDS}, 0 disables checking
 * @param loadIntoMemory read the files into heap memory instead of mapping them
 * @author Jens Wilke
 */
@Builder(toBuilder = true)
public record DatabaseConfig(
    String directory,
    String asnFile,
    String cityFile,
    String regionFile,
    String regionCountry,
    String asnCatalogFile,
    List<String> languages,
    Long reloadIntervalSeconds,
    boolean loadIntoMemory) {

  public static final String DEFAULT_DIRECTORY = "data";
  public static final String DEFAULT_ASN_FILE = "GeoLite2-ASN.mmdb";
  public static final String DEFAULT_CITY_FILE = "GeoLite2-City.mmdb";
  public static final String DEFAULT_REGION_FILE = "GeoCN.mmdb";
  public static final String DEFAULT_REGION_COUNTRY = "CN";
  public static final String DEFAULT_ASN_CATALOG_FILE = "asn_info.json";
  public static final long DEFAULT_RELOAD_INTERVAL_SECONDS = 3600;

  public static final DatabaseConfig DEFAULT = DatabaseConfig.builder().build();

  public DatabaseConfig {
    directory = directory == null ? DEFAULT_DIRECTORY : directory;
    asnFile = asnFile == null ? DEFAULT_ASN_FILE : asnFile;
    cityFile = cityFile == null ? DEFAULT_CITY_FILE : cityFile;
    regionFile = regionFile == null ? DEFAULT_REGION_FILE : regionFile;
    regionCountry = regionCountry == null ? DEFAULT_REGION_COUNTRY : regionCountry;
    asnCatalogFile = asnCatalogFile == null ? DEFAULT_ASN_CATALOG_FILE : asnCatalogFile;
    reloadIntervalSeconds =
        reloadIntervalSeconds == null ? DEFAULT_RELOAD_INTERVAL_SECONDS : reloadIntervalSeconds;
    languages = languages == null ? RegionNames.DEFAULT_LANGUAGES : List.copyOf(languages);
  }

  public Path resolve(String fileName) {
    return Path.of(directory).resolve(fileName);
  }
}
