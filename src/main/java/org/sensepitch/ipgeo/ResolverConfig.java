package org.sensepitch.ipgeo;

import lombok.Builder;

/**
 * @param timeoutMillis upper bound for each A and AAAA query, default {@value
 *     #DEFAULT_TIMEOUT_MILLIS}
 * @author Jens Wilke
 */
@Builder(toBuilder = true)
public record ResolverConfig(long timeoutMillis) {

  public static final long DEFAULT_TIMEOUT_MILLIS = 3000;

  public static final ResolverConfig DEFAULT = ResolverConfig.builder().build();

  public ResolverConfig {
    timeoutMillis = timeoutMillis <= 0 ? DEFAULT_TIMEOUT_MILLIS : timeoutMillis;
  }
}
