package org.sensepitch.ipgeo;

import io.netty.handler.codec.http.HttpHeaders;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Determines the address of the requesting client. Behind a CDN or reverse proxy the client
 * address is taken from the first header carrying a public address, otherwise the socket peer
 * address is used.
 *
 * @author Jens Wilke
 */
@Slf4j
public class ClientAddressResolver {

  static final List<String> CLIENT_ADDRESS_HEADERS =
      List.of(
          "cf-connecting-ip",
          "fastly-client-ip",
          "x-azure-clientip",
          "x-akamai-client-ip",
          "true-client-ip",
          "x-cdn-src-ip",
          "x-real-ip");

  static final String FORWARDED_FOR = "x-forwarded-for";
  static final String FORWARDED = "forwarded";

  private final boolean trustProxyHeaders;

  public ClientAddressResolver(boolean trustProxyHeaders) {
    this.trustProxyHeaders = trustProxyHeaders;
  }

  /**
   * @return the client address or {@code null} if neither headers nor the socket yield one
   */
  public Address resolve(HttpHeaders headers, SocketAddress remote) {
    if (trustProxyHeaders) {
      Address address = fromHeaders(headers);
      if (address != null) {
        return address;
      }
    }
    if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
      return Address.of(inet.getAddress());
    }
    return null;
  }

  Address fromHeaders(HttpHeaders headers) {
    for (String name : CLIENT_ADDRESS_HEADERS) {
      Address address = publicAddress(headers.get(name));
      if (address != null) {
        log.debug("Client address from " + name + ": " + address);
        return address;
      }
    }
    String forwardedFor = headers.get(FORWARDED_FOR);
    if (forwardedFor != null) {
      int comma = forwardedFor.indexOf(',');
      Address address =
          publicAddress(comma >= 0 ? forwardedFor.substring(0, comma) : forwardedFor);
      if (address != null) {
        return address;
      }
    }
    return publicAddress(forwardedForParameter(headers.get(FORWARDED)));
  }

  /** Value of the first {@code for=} parameter, e.g. {@code for="[2001:db8::1]:4711"}. */
  static String forwardedForParameter(String forwarded) {
    if (forwarded == null) {
      return null;
    }
    String firstElement = forwarded.split(",", 2)[0];
    for (String pair : firstElement.split(";")) {
      String trimmed = pair.trim();
      if (trimmed.regionMatches(true, 0, "for=", 0, 4)) {
        return stripQuotesAndPort(trimmed.substring(4).trim());
      }
    }
    return null;
  }

  private static String stripQuotesAndPort(String value) {
    String s = value;
    if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
      s = s.substring(1, s.length() - 1);
    }
    if (s.startsWith("[")) {
      int close = s.indexOf(']');
      return close > 0 ? s.substring(1, close) : s;
    }
    int colon = s.indexOf(':');
    if (colon > 0 && colon == s.lastIndexOf(':')) {
      return s.substring(0, colon);
    }
    return s;
  }

  private static Address publicAddress(String text) {
    if (text == null) {
      return null;
    }
    Address address = Address.parse(text.trim());
    if (address == null || ReservedRanges.isReserved(address)) {
      return null;
    }
    return address;
  }
}
