package org.sensepitch.ipgeo;

/**
 * Per-address lookup result. Each part may be {@code null} since a valid address may be unmapped
 * in one or all tables.
 *
 * @param address the looked up address
 * @param asn ASN table hit
 * @param network prefix of the ASN table hit, or the reserved block the address belongs to
 * @param placement placement from the winning source
 */
public record GeoRecord(
    Address address, AsnRecord asn, NetworkSpan network, GeoPlacement placement) {

  /** Category of the placement, falling back to the category of the network operator. */
  public String category() {
    if (placement != null && placement.category() != null) {
      return placement.category();
    }
    return asn != null ? asn.category() : null;
  }
}
