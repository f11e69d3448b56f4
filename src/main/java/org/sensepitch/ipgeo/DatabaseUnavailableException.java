package org.sensepitch.ipgeo;

/** No snapshot was published yet. */
public class DatabaseUnavailableException extends GeoServiceException {

  public static final String CODE = "DATABASE_UNAVAILABLE";

  public DatabaseUnavailableException(String message) {
    super(CODE, message);
  }
}
