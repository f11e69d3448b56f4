package org.sensepitch.ipgeo;

/** Neither the A nor the AAAA query produced an address, or resolution timed out. */
public class NoSuchHostException extends GeoServiceException {

  public static final String CODE = "NO_SUCH_HOST";

  public NoSuchHostException(String message) {
    super(CODE, message);
  }

  public NoSuchHostException(String message, Throwable cause) {
    super(CODE, message, cause);
  }
}
