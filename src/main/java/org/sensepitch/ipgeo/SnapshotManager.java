package org.sensepitch.ipgeo;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the live database snapshot. Readers get the current snapshot with a single volatile read
 * and never block, a reload builds the new snapshot completely before publishing it with one
 * reference swap. Lookups that captured the previous snapshot finish with it, it is reclaimed by
 * the garbage collector afterwards.
 *
 * <p>Reloads are serialized on the manager, the scheduled refresh runs on its own thread.
 *
 * @author Jens Wilke
 */
@Slf4j
public class SnapshotManager implements AutoCloseable {

  private final SnapshotLoader loader;
  private final GeoMetrics metrics;
  private final AtomicReference<DatabaseSnapshot> live = new AtomicReference<>();
  private final Object reloadLock = new Object();
  private long generation;
  private ScheduledExecutorService scheduler;

  public SnapshotManager(SnapshotLoader loader, GeoMetrics metrics) {
    this.loader = loader;
    this.metrics = metrics;
  }

  /**
   * Initial load.
   *
   * @throws DatabaseLoadException if a table cannot be loaded, the service cannot start
   */
  public DatabaseSnapshot start() {
    return reload();
  }

  /**
   * The live snapshot.
   *
   * @throws DatabaseUnavailableException if no snapshot was loaded yet
   */
  public DatabaseSnapshot current() {
    DatabaseSnapshot snapshot = live.get();
    if (snapshot == null) {
      throw new DatabaseUnavailableException("No database snapshot loaded");
    }
    return snapshot;
  }

  public boolean isLoaded() {
    return live.get() != null;
  }

  /**
   * Load a new snapshot and publish it. On failure the live snapshot stays in place.
   *
   * @throws DatabaseLoadException if a table cannot be loaded
   */
  public DatabaseSnapshot reload() {
    synchronized (reloadLock) {
      DatabaseSnapshot snapshot;
      try {
        snapshot = loader.load(generation + 1);
      } catch (RuntimeException e) {
        metrics.snapshotFailed();
        throw e;
      }
      generation = snapshot.generation();
      live.set(snapshot);
      metrics.snapshotPublished(snapshot);
      log.info("Database snapshot generation " + generation + " published");
      return snapshot;
    }
  }

  /**
   * Reload if the database files changed since the live snapshot was loaded. Failures are logged
   * and the live snapshot is retained, the next refresh retries.
   *
   * @return {@code true} if a new snapshot was published
   */
  public boolean refresh() {
    DatabaseSnapshot snapshot = live.get();
    if (snapshot != null && !loader.changedSince(snapshot)) {
      log.debug("Database files unchanged, generation " + snapshot.generation() + " stays live");
      return false;
    }
    try {
      reload();
      return true;
    } catch (RuntimeException e) {
      log.error(
          "Database reload failed, keeping generation "
              + (snapshot == null ? "none" : snapshot.generation()),
          e);
      return false;
    }
  }

  /** Check for changed database files periodically on a dedicated thread. */
  public synchronized void scheduleRefresh(long intervalSeconds) {
    if (intervalSeconds <= 0 || scheduler != null) {
      return;
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread thread = new Thread(r, "ipgeo-snapshot-refresh");
              thread.setDaemon(true);
              return thread;
            });
    scheduler.scheduleWithFixedDelay(
        this::refresh, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    log.info("Database refresh check every " + intervalSeconds + " seconds");
  }

  @Override
  public synchronized void close() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
    }
  }
}
