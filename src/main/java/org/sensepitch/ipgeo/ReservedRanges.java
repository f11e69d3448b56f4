package org.sensepitch.ipgeo;

import java.util.List;

/**
 * Well-known special purpose address blocks that are not announced in the public routing table,
 * e.g. private, loopback and documentation ranges.
 *
 * @author Jens Wilke
 */
public final class ReservedRanges {

  private static final List<NetworkSpan> RANGES =
      List.of(
          NetworkSpan.parse("0.0.0.0/8"),
          NetworkSpan.parse("10.0.0.0/8"),
          NetworkSpan.parse("100.64.0.0/10"),
          NetworkSpan.parse("127.0.0.0/8"),
          NetworkSpan.parse("169.254.0.0/16"),
          NetworkSpan.parse("172.16.0.0/12"),
          NetworkSpan.parse("192.0.0.0/24"),
          NetworkSpan.parse("192.0.2.0/24"),
          NetworkSpan.parse("192.168.0.0/16"),
          NetworkSpan.parse("198.18.0.0/15"),
          NetworkSpan.parse("198.51.100.0/24"),
          NetworkSpan.parse("203.0.113.0/24"),
          NetworkSpan.parse("224.0.0.0/4"),
          NetworkSpan.parse("240.0.0.0/4"),
          NetworkSpan.parse("255.255.255.255/32"),
          NetworkSpan.parse("::/128"),
          NetworkSpan.parse("::1/128"),
          NetworkSpan.parse("2001:db8::/32"),
          NetworkSpan.parse("fc00::/7"),
          NetworkSpan.parse("fe80::/10"),
          NetworkSpan.parse("ff00::/8"));

  private ReservedRanges() {}

  /**
   * Most specific reserved block containing the address.
   *
   * @return the block or {@code null} for a globally routable address
   */
  public static NetworkSpan find(Address address) {
    NetworkSpan best = null;
    for (NetworkSpan span : RANGES) {
      if (span.contains(address) && (best == null || span.prefixLength() > best.prefixLength())) {
        best = span;
      }
    }
    return best;
  }

  public static boolean isReserved(Address address) {
    return find(address) != null;
  }
}
