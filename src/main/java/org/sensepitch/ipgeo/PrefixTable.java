package org.sensepitch.ipgeo;

import java.io.IOException;

/**
 * Longest-prefix match lookup capability shared by the ASN, city and region tables.
 *
 * @param <T> value type of a table entry
 * @author Jens Wilke
 */
public interface PrefixTable<T> {

  /**
   * Most specific entry containing the address.
   *
   * @return the match or {@code null} if no range contains the address
   * @throws IOException if the underlying table cannot be read, e.g. it is corrupt
   */
  PrefixMatch<T> longestPrefixMatch(Address address) throws IOException;
}
