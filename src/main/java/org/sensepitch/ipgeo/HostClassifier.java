package org.sensepitch.ipgeo;

import java.net.IDN;
import java.util.Locale;

/**
 * Classifies a raw host string into an {@link Address} literal or a {@link Hostname}. IP literals,
 * including bracketed and zoned IPv6, are detected structurally before the hostname grammar is
 * tried. No network access happens here.
 *
 * @author Jens Wilke
 */
public class HostClassifier {

  /** Maximum length of a DNS name in its textual form without trailing dot. */
  public static final int MAX_HOSTNAME_LENGTH = 253;

  static final int MAX_LABEL_LENGTH = 63;

  public QueryTarget classify(String raw) {
    if (raw == null) {
      throw new InvalidHostException("Host missing");
    }
    String host = raw.trim();
    if (host.isEmpty()) {
      throw new InvalidHostException("Host missing");
    }
    int significant = host.endsWith(".") ? host.length() - 1 : host.length();
    if (significant > MAX_HOSTNAME_LENGTH) {
      throw new InvalidHostException("Host too long");
    }
    if (host.startsWith("[")) {
      if (!host.endsWith("]")) {
        throw new InvalidHostException("Unbalanced brackets: " + raw);
      }
      Address address = parseIpv6(host.substring(1, host.length() - 1));
      if (address == null) {
        throw new InvalidHostException("Invalid IPv6 literal: " + raw);
      }
      return address;
    }
    if (host.indexOf(':') >= 0) {
      Address address = parseIpv6(host);
      if (address == null) {
        throw new InvalidHostException("Invalid IPv6 literal: " + raw);
      }
      return address;
    }
    Address address = Address.parse(host);
    if (address != null) {
      return address;
    }
    return parseHostname(host, raw);
  }

  /** IPv6 literal, optionally with zone id which is dropped. */
  static Address parseIpv6(String text) {
    String literal = text;
    int percent = text.indexOf('%');
    if (percent >= 0) {
      if (!isValidZone(text.substring(percent + 1))) {
        return null;
      }
      literal = text.substring(0, percent);
    }
    if (literal.indexOf(':') < 0) {
      return null;
    }
    return Address.parse(literal);
  }

  static boolean isValidZone(String zone) {
    if (zone.isEmpty()) {
      return false;
    }
    for (int i = 0; i < zone.length(); i++) {
      char c = zone.charAt(i);
      if (!isAsciiLetterOrDigit(c) && c != '.' && c != '-' && c != '_') {
        return false;
      }
    }
    return true;
  }

  static Hostname parseHostname(String host, String raw) {
    String name = host;
    if (!isAscii(name)) {
      try {
        name = IDN.toASCII(name);
      } catch (IllegalArgumentException e) {
        throw new InvalidHostException("Invalid hostname: " + raw);
      }
    }
    if (name.endsWith(".")) {
      name = name.substring(0, name.length() - 1);
    }
    name = name.toLowerCase(Locale.ROOT);
    if (name.isEmpty()) {
      throw new InvalidHostException("Invalid hostname: " + raw);
    }
    if (name.length() > MAX_HOSTNAME_LENGTH) {
      throw new InvalidHostException("Hostname too long");
    }
    String[] labels = name.split("\\.", -1);
    for (String label : labels) {
      if (!isValidLabel(label)) {
        throw new InvalidHostException("Invalid hostname: " + raw);
      }
    }
    // an all numeric top level label means a broken IPv4 literal, e.g. 1.2.3.999
    if (isAllDigits(labels[labels.length - 1])) {
      throw new InvalidHostException("Invalid IPv4 literal: " + raw);
    }
    return new Hostname(name);
  }

  static boolean isValidLabel(String label) {
    if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
      return false;
    }
    if (label.charAt(0) == '-' || label.charAt(label.length() - 1) == '-') {
      return false;
    }
    for (int i = 0; i < label.length(); i++) {
      char c = label.charAt(i);
      if (!isAsciiLetterOrDigit(c) && c != '-' && c != '_') {
        return false;
      }
    }
    return true;
  }

  private static boolean isAllDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  private static boolean isAscii(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) > 0x7f) {
        return false;
      }
    }
    return true;
  }

  private static boolean isAsciiLetterOrDigit(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
