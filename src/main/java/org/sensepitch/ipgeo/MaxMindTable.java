package org.sensepitch.ipgeo;

import com.maxmind.db.DatabaseRecord;
import com.maxmind.db.Metadata;
import com.maxmind.db.Network;
import com.maxmind.db.Reader;
import java.io.IOException;

/**
 * Prefix table backed by a MaxMind DB file. The raw entry is decoded into {@code R} via its
 * {@link com.maxmind.db.MaxMindDbConstructor} and then converted into the domain value.
 *
 * @param <R> decoded database entry
 * @param <T> domain value
 * @author Jens Wilke
 */
public abstract class MaxMindTable<R, T> implements PrefixTable<T> {

  private final TableKind kind;
  private final Reader reader;
  private final Class<R> entryType;

  protected MaxMindTable(TableKind kind, Reader reader, Class<R> entryType) {
    this.kind = kind;
    this.reader = reader;
    this.entryType = entryType;
  }

  @Override
  public PrefixMatch<T> longestPrefixMatch(Address address) throws IOException {
    if (!address.isIpv4() && reader.getMetadata().getIpVersion() == 4) {
      return null;
    }
    DatabaseRecord<R> record = reader.getRecord(address.toInetAddress(), entryType);
    if (record == null || record.getData() == null) {
      return null;
    }
    T value = convert(record.getData());
    if (value == null) {
      return null;
    }
    return new PrefixMatch<>(value, toSpan(address, record.getNetwork()));
  }

  /**
   * Convert the decoded entry, returning {@code null} treats the entry as a miss.
   */
  protected abstract T convert(R entry);

  private static NetworkSpan toSpan(Address address, Network network) {
    if (network == null) {
      return null;
    }
    Address networkAddress = Address.of(network.getNetworkAddress());
    int prefixLength = network.getPrefixLength();
    if (networkAddress.bitLength() != address.bitLength()) {
      // IPv4 address found in the IPv4 subtree of an IPv6 database
      prefixLength = Math.max(0, prefixLength - 96);
      return NetworkSpan.of(address, prefixLength);
    }
    return NetworkSpan.of(networkAddress, prefixLength);
  }

  @Override
  public String toString() {
    Metadata metadata = reader.getMetadata();
    return kind.label()
        + "{type="
        + metadata.getDatabaseType()
        + ", buildDate="
        + metadata.getBuildDate()
        + "}";
  }
}
