package org.sensepitch.ipgeo;

/**
 * CIDR prefix that owns a lookup result.
 *
 * @param network first address of the network, host bits are zero
 * @param prefixLength number of leading network bits
 * @author Jens Wilke
 */
public record NetworkSpan(Address network, int prefixLength) {

  public NetworkSpan {
    if (prefixLength < 0 || prefixLength > network.bitLength()) {
      throw new IllegalArgumentException(
          "Prefix length " + prefixLength + " out of range for " + network);
    }
  }

  /** Span of the given prefix length containing the address, host bits cleared. */
  public static NetworkSpan of(Address address, int prefixLength) {
    byte[] raw = address.toByteArray();
    int remaining = prefixLength;
    for (int i = 0; i < raw.length; i++) {
      if (remaining >= 8) {
        remaining -= 8;
      } else {
        raw[i] = (byte) (raw[i] & (0xff << (8 - remaining)));
        remaining = 0;
      }
    }
    return new NetworkSpan(Address.of(raw), prefixLength);
  }

  /** Parses CIDR notation, e.g. {@code 10.0.0.0/8} or {@code fc00::/7}. */
  public static NetworkSpan parse(String cidr) {
    int slash = cidr.indexOf('/');
    if (slash < 0) {
      throw new IllegalArgumentException("Missing prefix length: " + cidr);
    }
    Address address = Address.parse(cidr.substring(0, slash));
    if (address == null) {
      throw new IllegalArgumentException("Illegal network address: " + cidr);
    }
    return of(address, Integer.parseInt(cidr.substring(slash + 1)));
  }

  public boolean contains(Address address) {
    if (address.bitLength() != network.bitLength()) {
      return false;
    }
    for (int i = 0; i < prefixLength; i++) {
      if (address.bit(i) != network.bit(i)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return network + "/" + prefixLength;
  }
}
