package org.sensepitch.ipgeo;

import static org.assertj.core.api.Assertions.assertThat;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import java.net.InetSocketAddress;
import org.junit.jupiter.api.Test;

/**
 * @author Jens Wilke
 */
class ClientAddressResolverTest {

  private static final InetSocketAddress PEER = new InetSocketAddress("198.51.100.7", 40000);
  private static final InetSocketAddress PUBLIC_PEER = new InetSocketAddress("9.9.9.9", 40000);

  private final ClientAddressResolver resolver = new ClientAddressResolver(true);
  private final HttpHeaders headers = new DefaultHttpHeaders();

  private String resolve() {
    Address address = resolver.resolve(headers, PEER);
    return address == null ? null : address.toString();
  }

  @Test
  void noHeaders_socketAddress() {
    assertThat(resolve()).isEqualTo("198.51.100.7");
  }

  @Test
  void cdnHeaderPrecedence() {
    headers.set("X-Real-IP", "5.5.5.5");
    headers.set("True-Client-IP", "4.4.4.4");
    headers.set("CF-Connecting-IP", "1.1.1.1");
    assertThat(resolve()).isEqualTo("1.1.1.1");
    headers.remove("CF-Connecting-IP");
    assertThat(resolve()).isEqualTo("4.4.4.4");
  }

  @Test
  void privateHeaderValueSkipped() {
    headers.set("CF-Connecting-IP", "10.1.1.1");
    headers.set("X-Real-IP", "8.8.4.4");
    assertThat(resolve()).isEqualTo("8.8.4.4");
  }

  @Test
  void forwardedFor_firstEntry() {
    headers.set("X-Forwarded-For", "2001:4860::1 , 8.8.8.8");
    assertThat(resolve()).isEqualTo("2001:4860::1");
  }

  @Test
  void forwarded_forParameter() {
    headers.set("Forwarded", "for=\"[2001:4860::1]:4711\";proto=https, for=8.8.8.8");
    assertThat(resolve()).isEqualTo("2001:4860::1");
    headers.set("Forwarded", "proto=http;For=8.8.8.8:80");
    assertThat(resolve()).isEqualTo("8.8.8.8");
  }

  @Test
  void forwardedParameterParsing() {
    assertThat(ClientAddressResolver.forwardedForParameter("for=192.0.2.60;proto=http"))
        .isEqualTo("192.0.2.60");
    assertThat(ClientAddressResolver.forwardedForParameter("for=unknown")).isEqualTo("unknown");
    assertThat(ClientAddressResolver.forwardedForParameter("by=203.0.113.43")).isNull();
    assertThat(ClientAddressResolver.forwardedForParameter(null)).isNull();
  }

  @Test
  void garbageHeader_fallsBackToSocket() {
    headers.set("X-Forwarded-For", "unknown");
    headers.set("X-Real-IP", "not-an-ip");
    assertThat(resolve()).isEqualTo("198.51.100.7");
  }

  @Test
  void untrusted_headersIgnored() {
    headers.set("CF-Connecting-IP", "1.1.1.1");
    Address address = new ClientAddressResolver(false).resolve(headers, PUBLIC_PEER);
    assertThat(address).hasToString("9.9.9.9");
  }

  @Test
  void noInetAddress_null() {
    assertThat(new ClientAddressResolver(false).resolve(headers, null)).isNull();
  }
}
