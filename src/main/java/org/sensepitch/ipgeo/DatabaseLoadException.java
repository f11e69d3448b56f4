package org.sensepitch.ipgeo;

/**
 * A database file is missing or failed structural validation. Fatal at startup, during background
 * refresh the previous snapshot is kept.
 */
public class DatabaseLoadException extends GeoServiceException {

  public static final String CODE = "DATABASE_LOAD_ERROR";

  private final TableKind table;

  public DatabaseLoadException(TableKind table, String message) {
    super(CODE, table.label() + ": " + message);
    this.table = table;
  }

  public DatabaseLoadException(TableKind table, String message, Throwable cause) {
    super(CODE, table.label() + ": " + message, cause);
    this.table = table;
  }

  public TableKind table() {
    return table;
  }
}
