package org.sensepitch.ipgeo;

/**
 * Table entry together with the prefix it was found under.
 *
 * @author Jens Wilke
 */
public record PrefixMatch<T>(T value, NetworkSpan network) {}
