package org.sensepitch.ipgeo;

import io.netty.util.NetUtil;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * Normalized IPv4 or IPv6 address. Equality and hashing work on the binary form, so different
 * textual spellings of the same address are equal. IPv4-mapped IPv6 addresses ({@code
 * ::ffff:a.b.c.d}) are normalized to IPv4.
 *
 * @author Jens Wilke
 */
public final class Address implements QueryTarget {

  private static final int IPV4_BYTES = 4;
  private static final int IPV6_BYTES = 16;

  private final byte[] bytes;

  private Address(byte[] bytes) {
    this.bytes = bytes;
  }

  public static Address of(byte[] raw) {
    if (raw.length == IPV4_BYTES) {
      return new Address(raw.clone());
    }
    if (raw.length != IPV6_BYTES) {
      throw new IllegalArgumentException("Illegal address length " + raw.length);
    }
    if (isIpv4Mapped(raw)) {
      return new Address(Arrays.copyOfRange(raw, 12, 16));
    }
    return new Address(raw.clone());
  }

  public static Address of(InetAddress address) {
    return of(address.getAddress());
  }

  /**
   * Parse an IP literal without any name lookup.
   *
   * @return the address or {@code null} if the text is no IPv4 or IPv6 literal
   */
  public static Address parse(String literal) {
    if (literal == null || literal.isEmpty()) {
      return null;
    }
    if (!NetUtil.isValidIpV4Address(literal) && !NetUtil.isValidIpV6Address(literal)) {
      return null;
    }
    byte[] raw = NetUtil.createByteArrayFromIpAddressString(literal);
    if (raw == null) {
      return null;
    }
    return of(raw);
  }

  private static boolean isIpv4Mapped(byte[] raw) {
    for (int i = 0; i < 10; i++) {
      if (raw[i] != 0) {
        return false;
      }
    }
    return raw[10] == (byte) 0xff && raw[11] == (byte) 0xff;
  }

  public boolean isIpv4() {
    return bytes.length == IPV4_BYTES;
  }

  /** 32 or 128 */
  public int bitLength() {
    return bytes.length * 8;
  }

  /** Bit at the position, counting from the most significant bit of the first byte. */
  public int bit(int index) {
    return (bytes[index >>> 3] >>> (7 - (index & 7))) & 1;
  }

  public byte[] toByteArray() {
    return bytes.clone();
  }

  public InetAddress toInetAddress() {
    try {
      return InetAddress.getByAddress(bytes);
    } catch (UnknownHostException e) {
      // only thrown for illegal length
      throw new IllegalStateException(e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Address other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  /** Canonical text form, RFC 5952 for IPv6 */
  @Override
  public String toString() {
    return NetUtil.bytesToIpAddress(bytes);
  }
}
