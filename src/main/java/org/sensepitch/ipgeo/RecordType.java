package org.sensepitch.ipgeo;

/**
 * DNS address record types queried for a hostname, in query order.
 *
 * @author Jens Wilke
 */
public enum RecordType {
  A,
  AAAA
}
