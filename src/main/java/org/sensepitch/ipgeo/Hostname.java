package org.sensepitch.ipgeo;

/**
 * Normalized DNS name, lower case and without trailing dot.
 *
 * @param name the normalized name
 */
public record Hostname(String name) implements QueryTarget {

  @Override
  public String toString() {
    return name;
  }
}
