package org.sensepitch.ipgeo;

/**
 * Builds a database snapshot from its sources.
 *
 * @author Jens Wilke
 */
public interface SnapshotLoader {

  /**
   * Load all tables.
   *
   * @param generation generation number of the new snapshot
   * @throws DatabaseLoadException naming the table that failed
   */
  DatabaseSnapshot load(long generation);

  /** True if the sources changed since the snapshot was loaded. */
  default boolean changedSince(DatabaseSnapshot snapshot) {
    return true;
  }
}
