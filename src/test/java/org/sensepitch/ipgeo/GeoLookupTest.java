package org.sensepitch.ipgeo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.sensepitch.ipgeo.TestSnapshots.BEIJING_CITY;
import static org.sensepitch.ipgeo.TestSnapshots.CHINA;
import static org.sensepitch.ipgeo.TestSnapshots.HANGZHOU_REGION;
import static org.sensepitch.ipgeo.TestSnapshots.MOUNTAIN_VIEW;

import java.io.IOException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/**
 * @author Jens Wilke
 */
class GeoLookupTest {

  private final GeoMetrics metrics = new GeoMetrics();
  private final GeoLookup lookup = new GeoLookup(metrics);
  private final DatabaseSnapshot snapshot = TestSnapshots.snapshot(1);

  private GeoRecord lookup(String address) {
    return lookup.lookup(Address.parse(address), snapshot);
  }

  @Test
  void regionTableWins_forCoveredCountry() {
    GeoRecord record = lookup("1.2.3.4");
    GeoPlacement placement = record.placement();
    assertThat(placement.latitude()).isEqualTo(HANGZHOU_REGION.latitude());
    assertThat(placement.longitude()).isEqualTo(HANGZHOU_REGION.longitude());
    assertThat(placement.regions()).containsExactly("浙江省", "杭州市", "西湖区");
    assertThat(placement.regionCodes()).containsExactly("浙江", "杭州", "西湖");
    assertThat(placement.category()).isEqualTo("数据中心");
    assertThat(placement.country()).isEqualTo(CHINA);
    assertThat(placement.registeredCountry()).isEqualTo(CHINA);
    assertThat(record.asn().number()).isEqualTo(4134);
    assertThat(record.network()).hasToString("1.2.0.0/16");
    assertThat(metrics.lookups.labelValues(GeoLookup.SOURCE_REGION).get()).isEqualTo(1);
  }

  @Test
  void asnEnrichedFromCatalog() {
    AsnRecord asn = lookup("1.2.3.4").asn();
    assertThat(asn.organization()).isEqualTo("Chinanet");
    assertThat(asn.info()).isEqualTo("电信");
    assertThat(asn.category()).isEqualTo("宽带");
  }

  @Test
  void regionMiss_cityBaselineStands() {
    GeoRecord record = lookup("1.2.4.1");
    assertThat(record.placement()).isEqualTo(BEIJING_CITY);
    assertThat(record.category()).isEqualTo("宽带");
    assertThat(metrics.lookups.labelValues(GeoLookup.SOURCE_CITY).get()).isEqualTo(1);
  }

  @Test
  void otherCountry_regionTableNotConsulted() {
    // the region table has an entry for 8.8.8.0/24 which must be ignored
    GeoRecord record = lookup("8.8.8.8");
    assertThat(record.placement()).isEqualTo(MOUNTAIN_VIEW);
    assertThat(record.asn()).isEqualTo(TestSnapshots.GOOGLE);
    assertThat(record.network()).hasToString("8.8.8.0/24");
    assertThat(record.category()).isNull();
  }

  @Test
  void cityOnlyWithoutAsn() {
    GeoRecord record = lookup("1.3.0.1");
    assertThat(record.asn()).isNull();
    assertThat(record.network()).isNull();
    assertThat(record.placement()).isEqualTo(BEIJING_CITY);
  }

  @Test
  void privateAddress_absentIsSuccess() {
    GeoRecord record = lookup("10.0.0.0");
    assertThat(record.address()).isEqualTo(Address.parse("10.0.0.0"));
    assertThat(record.asn()).isNull();
    assertThat(record.placement()).isNull();
    assertThat(record.network()).hasToString("10.0.0.0/8");
    assertThat(metrics.lookups.labelValues(GeoLookup.SOURCE_NONE).get()).isEqualTo(1);
  }

  @Test
  void unmappedPublicAddress_allAbsent() {
    GeoRecord record = lookup("9.9.9.9");
    assertThat(record.asn()).isNull();
    assertThat(record.network()).isNull();
    assertThat(record.placement()).isNull();
  }

  @Test
  void ipv6Lookup() {
    GeoRecord record = lookup("2001:4860:4860::8888");
    assertThat(record.asn().number()).isEqualTo(15169);
    assertThat(record.network()).hasToString("2001:4860::/32");
    assertThat(record.placement()).isEqualTo(MOUNTAIN_VIEW);
  }

  @Test
  void regionCountryComparedCaseInsensitive() {
    DatabaseSnapshot lowerCase =
        new DatabaseSnapshot(
            TestSnapshots.asnTable(),
            TestSnapshots.cityTable(),
            TestSnapshots.regionTable(),
            "cn",
            AsnCatalog.EMPTY,
            Instant.now(),
            1,
            null);
    GeoRecord record = lookup.lookup(Address.parse("1.2.3.4"), lowerCase);
    assertThat(record.placement().regions()).containsExactly("浙江省", "杭州市", "西湖区");
  }

  @Test
  void tableReadError_treatedAsMiss() {
    PrefixTable<GeoPlacement> broken =
        address -> {
          throw new IOException("corrupt search tree");
        };
    DatabaseSnapshot withBrokenRegion =
        new DatabaseSnapshot(
            TestSnapshots.asnTable(),
            TestSnapshots.cityTable(),
            broken,
            "CN",
            AsnCatalog.EMPTY,
            Instant.now(),
            1,
            null);
    GeoRecord record = lookup.lookup(Address.parse("1.2.3.4"), withBrokenRegion);
    assertThat(record.placement()).isEqualTo(BEIJING_CITY);
    assertThat(record.asn().number()).isEqualTo(4134);
    assertThat(record.asn().info()).isNull();
  }

  @Test
  void tableDecodeError_treatedAsMiss() {
    PrefixTable<AsnRecord> broken =
        address -> {
          throw new IllegalStateException("Error getting record for IP " + address);
        };
    DatabaseSnapshot withBrokenAsn =
        new DatabaseSnapshot(
            broken,
            TestSnapshots.cityTable(),
            TestSnapshots.regionTable(),
            "CN",
            TestSnapshots.catalog(),
            Instant.now(),
            1,
            null);
    GeoRecord record = lookup.lookup(Address.parse("1.2.3.4"), withBrokenAsn);
    assertThat(record.asn()).isNull();
    assertThat(record.placement().regions()).isEqualTo(HANGZHOU_REGION.regions());
    assertThat(record.placement().country()).isEqualTo(CHINA);
  }
}
