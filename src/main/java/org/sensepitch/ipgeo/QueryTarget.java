package org.sensepitch.ipgeo;

/**
 * Result of classifying a host string, either an {@link Address} literal or a {@link Hostname}
 * that still needs resolving.
 */
public interface QueryTarget {}
