package org.sensepitch.ipgeo;

import com.maxmind.db.Metadata;
import com.maxmind.db.Reader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the ASN, city and region tables from MaxMind DB files plus the optional ASN catalog.
 * Files are memory mapped unless configured to be read into memory. Readers of a live snapshot are
 * not closed explicitly, the mapped buffers are released when the last lookup holding the snapshot
 * is done and the snapshot is garbage collected. Readers of a load that fails are closed.
 *
 * @author Jens Wilke
 */
@Slf4j
public class MaxMindSnapshotLoader implements SnapshotLoader {

  private final DatabaseConfig config;
  private final DatabaseFiles files;
  private final RegionNames regionNames;
  private final Clock clock;

  public MaxMindSnapshotLoader(DatabaseConfig config) {
    this(config, Clock.systemUTC());
  }

  MaxMindSnapshotLoader(DatabaseConfig config, Clock clock) {
    this.config = config;
    this.files = DatabaseFiles.of(config);
    this.regionNames = new RegionNames(config.languages());
    this.clock = clock;
  }

  @Override
  public DatabaseSnapshot load(long generation) {
    DatabaseFiles.Fingerprint fingerprint = files.fingerprint();
    List<Reader> opened = new ArrayList<>();
    AsnCatalog catalog;
    try {
      opened.add(open(TableKind.ASN, files.asn(), "ASN"));
      opened.add(open(TableKind.CITY, files.city(), "City"));
      opened.add(open(TableKind.REGION, files.region(), null));
      catalog = AsnCatalog.load(files.asnCatalog());
    } catch (DatabaseLoadException ex) {
      throw closeAfterFailure(opened, ex);
    }
    DatabaseSnapshot snapshot =
        new DatabaseSnapshot(
            new AsnTable(opened.get(0)),
            new CityTable(opened.get(1), regionNames),
            new RegionTable(opened.get(2)),
            config.regionCountry(),
            catalog,
            clock.instant(),
            generation,
            fingerprint);
    log.info("Database snapshot loaded: " + snapshot);
    return snapshot;
  }

  @Override
  public boolean changedSince(DatabaseSnapshot snapshot) {
    return !files.fingerprint().equals(snapshot.fingerprint());
  }

  /**
   * Open and validate a table.
   *
   * @param expectedType text the database type must contain, or {@code null} for no check
   */
  Reader open(TableKind kind, Path file, String expectedType) {
    if (!Files.isRegularFile(file)) {
      throw new DatabaseLoadException(kind, "File not found: " + file);
    }
    Reader reader;
    try {
      reader =
          new Reader(
              file.toFile(),
              config.loadIntoMemory() ? Reader.FileMode.MEMORY : Reader.FileMode.MEMORY_MAPPED);
    } catch (IOException | RuntimeException e) {
      throw new DatabaseLoadException(kind, "Cannot open " + file + ": " + e.getMessage(), e);
    }
    Metadata metadata = reader.getMetadata();
    if (metadata.getBinaryFormatMajorVersion() != 2) {
      throw closeAfterFailure(
          List.of(reader),
          new DatabaseLoadException(
              kind,
              "Unsupported format version "
                  + metadata.getBinaryFormatMajorVersion()
                  + " in "
                  + file));
    }
    if (metadata.getIpVersion() != 4 && metadata.getIpVersion() != 6) {
      throw closeAfterFailure(
          List.of(reader),
          new DatabaseLoadException(
              kind, "Illegal IP version " + metadata.getIpVersion() + " in " + file));
    }
    String databaseType = metadata.getDatabaseType();
    if (expectedType != null && (databaseType == null || !databaseType.contains(expectedType))) {
      throw closeAfterFailure(
          List.of(reader),
          new DatabaseLoadException(
              kind, "Unexpected database type '" + databaseType + "' in " + file));
    }
    log.info(
        kind.label()
            + " database opened, file="
            + file
            + ", type="
            + databaseType
            + ", buildDate="
            + metadata.getBuildDate());
    return reader;
  }

  /** Close readers already opened, a failure to close is added as suppressed. */
  private static DatabaseLoadException closeAfterFailure(
      List<Reader> readers, DatabaseLoadException ex) {
    for (Reader reader : readers) {
      try {
        reader.close();
      } catch (IOException e) {
        ex.addSuppressed(e);
      }
    }
    return ex;
  }
}
