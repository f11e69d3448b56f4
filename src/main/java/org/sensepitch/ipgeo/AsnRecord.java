package org.sensepitch.ipgeo;

/**
 * Network operator owning an address range.
 *
 * @param number autonomous system number, unsigned 32 bit
 * @param organization organization name as registered in the ASN database
 * @param info localized operator name from the {@link AsnCatalog}, or {@code null}
 * @param category network use category from the {@link AsnCatalog}, or {@code null}
 */
public record AsnRecord(long number, String organization, String info, String category) {

  public AsnRecord withCatalogEntry(AsnCatalog.Entry entry) {
    if (entry == null) {
      return this;
    }
    return new AsnRecord(number, organization, entry.name(), entry.type());
  }
}
