package org.sensepitch.ipgeo;

import com.maxmind.db.MaxMindDbConstructor;
import com.maxmind.db.MaxMindDbParameter;
import com.maxmind.db.Reader;

/**
 * ASN table, e.g. GeoLite2-ASN.
 *
 * @author Jens Wilke
 */
public class AsnTable extends MaxMindTable<AsnTable.AsnEntry, AsnRecord> {

  public AsnTable(Reader reader) {
    super(TableKind.ASN, reader, AsnEntry.class);
  }

  @Override
  protected AsnRecord convert(AsnEntry entry) {
    if (entry.number == null) {
      return null;
    }
    return new AsnRecord(entry.number, entry.organization, null, null);
  }

  public static class AsnEntry {

    final Long number;
    final String organization;

    @MaxMindDbConstructor
    public AsnEntry(
        @MaxMindDbParameter(name = "autonomous_system_number") Long number,
        @MaxMindDbParameter(name = "autonomous_system_organization") String organization) {
      this.number = number;
      this.organization = organization;
    }
  }
}
