package org.sensepitch.ipgeo;

/** The host string is neither an IP literal nor a valid DNS hostname. */
public class InvalidHostException extends GeoServiceException {

  public static final String CODE = "INVALID_HOST";

  public InvalidHostException(String message) {
    super(CODE, message);
  }
}
