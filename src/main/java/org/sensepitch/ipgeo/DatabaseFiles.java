package org.sensepitch.ipgeo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Paths of the database files and their fingerprint, which changes when the updater replaces a
 * file.
 *
 * @author Jens Wilke
 */
public record DatabaseFiles(Path asn, Path city, Path region, Path asnCatalog) {

  public static DatabaseFiles of(DatabaseConfig config) {
    return new DatabaseFiles(
        config.resolve(config.asnFile()),
        config.resolve(config.cityFile()),
        config.resolve(config.regionFile()),
        config.resolve(config.asnCatalogFile()));
  }

  public Fingerprint fingerprint() {
    List<FileState> states = new ArrayList<>();
    for (Path path : List.of(asn, city, region, asnCatalog)) {
      states.add(FileState.of(path));
    }
    return new Fingerprint(states);
  }

  /** Size and modification time of every file, compared by value. */
  public record Fingerprint(List<FileState> files) {

    public static final Fingerprint NONE = new Fingerprint(List.of());

    public Fingerprint {
      files = List.copyOf(files);
    }
  }

  /**
   * @param size file size or -1 if the file does not exist
   * @param lastModifiedMillis modification time or -1 if the file does not exist
   */
  public record FileState(Path path, long size, long lastModifiedMillis) {

    static FileState of(Path path) {
      try {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileState(path, attributes.size(), attributes.lastModifiedTime().toMillis());
      } catch (IOException e) {
        return new FileState(path, -1, -1);
      }
    }
  }
}
