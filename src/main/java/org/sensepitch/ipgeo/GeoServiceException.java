package org.sensepitch.ipgeo;

/**
 * Base of all failures that are reported to clients or operators with a machine readable code.
 *
 * @author Jens Wilke
 */
public class GeoServiceException extends RuntimeException {

  private final String code;

  public GeoServiceException(String code, String message) {
    super(message);
    this.code = code;
  }

  public GeoServiceException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /** Machine readable error code, e.g. {@code INVALID_HOST} */
  public String code() {
    return code;
  }
}
