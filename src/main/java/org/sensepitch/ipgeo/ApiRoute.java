package org.sensepitch.ipgeo;

import io.netty.handler.codec.http.QueryStringDecoder;
import java.util.List;

/**
 * Maps a request URI onto one of the entry points. The host may be percent encoded, e.g. an IPv6
 * literal in the query parameter.
 *
 * <ul>
 *   <li>{@code GET /} query the client address
 *   <li>{@code GET /{host}} query the host
 *   <li>{@code GET /api/{host}} query the host
 *   <li>{@code GET /api?host={host}} query the host, or the client address if the parameter is
 *       absent
 * </ul>
 *
 * @param host host to query, {@code null} to query the client address
 * @author Jens Wilke
 */
public record ApiRoute(Endpoint endpoint, String host) {

  public static final String API_SEGMENT = "api";
  public static final String HOST_PARAMETER = "host";

  /** Parse the URI, a malformed percent encoding yields the {@link Endpoint#MALFORMED} route. */
  public static ApiRoute parse(String uri) {
    try {
      return parseOrFail(uri);
    } catch (IllegalArgumentException e) {
      return new ApiRoute(Endpoint.MALFORMED, null);
    }
  }

  private static ApiRoute parseOrFail(String uri) {
    QueryStringDecoder decoder = new QueryStringDecoder(uri);
    String path = decoder.rawPath();
    if (path.startsWith("/")) {
      path = path.substring(1);
    }
    if (path.isEmpty()) {
      return new ApiRoute(Endpoint.ROOT, null);
    }
    String[] segments = path.split("/", -1);
    if (segments.length == 1) {
      if (API_SEGMENT.equals(segments[0])) {
        List<String> hosts = decoder.parameters().get(HOST_PARAMETER);
        return new ApiRoute(Endpoint.API_QUERY, hosts == null ? null : hosts.get(0));
      }
      return new ApiRoute(Endpoint.PATH, decode(segments[0]));
    }
    if (segments.length == 2 && API_SEGMENT.equals(segments[0])) {
      return new ApiRoute(Endpoint.API_PATH, decode(segments[1]));
    }
    return new ApiRoute(Endpoint.UNKNOWN, null);
  }

  private static String decode(String segment) {
    return QueryStringDecoder.decodeComponent(segment);
  }

  public boolean queriesClient() {
    return host == null
        && (endpoint == Endpoint.ROOT || endpoint == Endpoint.API_QUERY);
  }

  public enum Endpoint {
    ROOT("root"),
    PATH("path"),
    API_PATH("api_path"),
    API_QUERY("api_query"),
    UNKNOWN("unknown"),
    MALFORMED("malformed");

    private final String label;

    Endpoint(String label) {
      this.label = label;
    }

    /** Metrics label */
    public String label() {
      return label;
    }
  }
}
