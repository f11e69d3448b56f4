package org.sensepitch.ipgeo;

/**
 * The data sources making up a {@link DatabaseSnapshot}.
 *
 * @author Jens Wilke
 */
public enum TableKind {
  ASN("asn"),
  CITY("city"),
  REGION("region"),
  ASN_CATALOG("asn-catalog");

  private final String label;

  TableKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
