package org.sensepitch.ipgeo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders results and errors as JSON. A literal or client address query renders the record at the
 * top level, a hostname query renders {@code {"host": ..., "ips": [...]}}. Absent fields are
 * omitted. The field order is fixed, so identical results render to identical bytes.
 *
 * @author Jens Wilke
 */
public class ResponseAssembler {

  private final ObjectMapper mapper = new ObjectMapper();

  public byte[] assemble(ResolutionResult result) {
    if (result.literal() && result.records().size() == 1) {
      return write(toIpInfo(result.records().get(0)));
    }
    List<IpInfo> ips = new ArrayList<>();
    for (GeoRecord record : result.records()) {
      ips.add(toIpInfo(record));
    }
    return write(new HostInfo(result.host(), ips));
  }

  public byte[] error(int status, String code, String message) {
    return write(new ErrorBody(status, code, message));
  }

  private byte[] write(Object value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  static IpInfo toIpInfo(GeoRecord record) {
    AsInfo as = null;
    if (record.asn() != null) {
      AsnRecord asn = record.asn();
      as = new AsInfo(asn.number(), asn.organization(), asn.info());
    }
    GeoPlacement placement = record.placement();
    Location location = null;
    CountryInfo country = null;
    CountryInfo registeredCountry = null;
    List<String> regions = null;
    List<String> regionsShort = null;
    if (placement != null) {
      if (placement.hasLocation()) {
        location = new Location(placement.latitude(), placement.longitude());
      }
      country = toCountryInfo(placement.country());
      registeredCountry = toCountryInfo(placement.registeredCountry());
      regions = placement.regions().isEmpty() ? null : placement.regions();
      regionsShort = placement.regionCodes().isEmpty() ? null : placement.regionCodes();
    }
    return new IpInfo(
        record.address().toString(),
        as,
        record.network() == null ? null : record.network().toString(),
        location,
        country,
        registeredCountry,
        regions,
        regionsShort,
        record.category());
  }

  private static CountryInfo toCountryInfo(Country country) {
    return country == null ? null : new CountryInfo(country.code(), country.name());
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({
    "ip",
    "as",
    "addr",
    "location",
    "country",
    "registered_country",
    "regions",
    "regions_short",
    "type"
  })
  record IpInfo(
      String ip,
      @JsonProperty("as") AsInfo as,
      String addr,
      Location location,
      CountryInfo country,
      @JsonProperty("registered_country") CountryInfo registeredCountry,
      List<String> regions,
      @JsonProperty("regions_short") List<String> regionsShort,
      String type) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"number", "name", "info"})
  record AsInfo(long number, String name, String info) {}

  @JsonPropertyOrder({"latitude", "longitude"})
  record Location(double latitude, double longitude) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"code", "name"})
  record CountryInfo(String code, String name) {}

  @JsonPropertyOrder({"host", "ips"})
  record HostInfo(String host, List<IpInfo> ips) {}

  @JsonPropertyOrder({"code", "error", "message"})
  record ErrorBody(int code, String error, String message) {}
}
