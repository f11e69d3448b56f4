package org.sensepitch.ipgeo;

import lombok.Builder;

/**
 * @param port HTTP port, default is {@value #DEFAULT_PORT}
 * @param trustProxyHeaders take the client address for {@code GET /} from CDN and proxy headers
 *     like {@code X-Forwarded-For}. Enable only when the service sits behind a proxy that
 *     overwrites them. Default is {@code true}.
 * @author Jens Wilke
 */
@Builder(toBuilder = true)
public record ListenConfig(int port, Boolean trustProxyHeaders) {

  public static final int DEFAULT_PORT = 8080;

  public static final ListenConfig DEFAULT = ListenConfig.builder().build();

  public ListenConfig {
    port = port == 0 ? DEFAULT_PORT : port;
    trustProxyHeaders = trustProxyHeaders == null ? Boolean.TRUE : trustProxyHeaders;
  }
}
