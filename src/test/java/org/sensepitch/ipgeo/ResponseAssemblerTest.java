package org.sensepitch.ipgeo;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * @author Jens Wilke
 */
class ResponseAssemblerTest {

  private final ResponseAssembler assembler = new ResponseAssembler();

  private String assemble(ResolutionResult result) {
    return new String(assembler.assemble(result), StandardCharsets.UTF_8);
  }

  private static GeoRecord record(String address, AsnRecord asn, String network, GeoPlacement p) {
    return new GeoRecord(
        Address.parse(address), asn, network == null ? null : NetworkSpan.parse(network), p);
  }

  @Test
  void literal_allFieldsInOrder() {
    GeoRecord record =
        record(
            "1.2.3.4",
            TestSnapshots.CHINANET.withCatalogEntry(new AsnCatalog.Entry("电信", "宽带")),
            "1.2.0.0/16",
            TestSnapshots.HANGZHOU_REGION.toBuilder()
                .country(TestSnapshots.CHINA)
                .registeredCountry(TestSnapshots.CHINA)
                .build());
    assertThat(assemble(new ResolutionResult("1.2.3.4", true, List.of(record))))
        .isEqualTo(
            "{\"ip\":\"1.2.3.4\","
                + "\"as\":{\"number\":4134,\"name\":\"Chinanet\",\"info\":\"电信\"},"
                + "\"addr\":\"1.2.0.0/16\","
                + "\"location\":{\"latitude\":30.2741,\"longitude\":120.1551},"
                + "\"country\":{\"code\":\"CN\",\"name\":\"中国\"},"
                + "\"registered_country\":{\"code\":\"CN\",\"name\":\"中国\"},"
                + "\"regions\":[\"浙江省\",\"杭州市\",\"西湖区\"],"
                + "\"regions_short\":[\"浙江\",\"杭州\",\"西湖\"],"
                + "\"type\":\"数据中心\"}");
  }

  @Test
  void absentFieldsOmitted() {
    GeoRecord record =
        record(
            "9.9.9.9",
            new AsnRecord(19281, "QUAD9-AS-1", null, null),
            null,
            GeoPlacement.builder().country(new Country("CH", null)).build());
    assertThat(assemble(new ResolutionResult("9.9.9.9", true, List.of(record))))
        .isEqualTo(
            "{\"ip\":\"9.9.9.9\",\"as\":{\"number\":19281,\"name\":\"QUAD9-AS-1\"},"
                + "\"country\":{\"code\":\"CH\"}}");
  }

  @Test
  void hostname_listShape() {
    ResolutionResult result =
        new ResolutionResult(
            "example.com",
            false,
            List.of(
                record("192.0.2.1", null, "192.0.2.0/24", null),
                record("2001:db8::1", null, null, null)));
    assertThat(assemble(result))
        .isEqualTo(
            "{\"host\":\"example.com\",\"ips\":["
                + "{\"ip\":\"192.0.2.1\",\"addr\":\"192.0.2.0/24\"},"
                + "{\"ip\":\"2001:db8::1\"}]}");
  }

  @Test
  void hostnameWithSingleAddress_keepsListShape() {
    ResolutionResult result =
        new ResolutionResult("one.example", false, List.of(record("192.0.2.1", null, null, null)));
    assertThat(assemble(result)).startsWith("{\"host\":\"one.example\",\"ips\":[");
  }

  @Test
  void deterministic() {
    ResolutionResult result =
        new ResolutionResult(
            "8.8.8.8",
            true,
            List.of(
                record(
                    "8.8.8.8", TestSnapshots.GOOGLE, "8.8.8.0/24", TestSnapshots.MOUNTAIN_VIEW)));
    assertThat(assembler.assemble(result)).isEqualTo(assembler.assemble(result));
  }

  @Test
  void error() {
    byte[] body = assembler.error(404, "NO_SUCH_HOST", "Cannot resolve x.example");
    assertThat(new String(body, StandardCharsets.UTF_8))
        .isEqualTo(
            "{\"code\":404,\"error\":\"NO_SUCH_HOST\",\"message\":\"Cannot resolve x.example\"}");
  }
}
