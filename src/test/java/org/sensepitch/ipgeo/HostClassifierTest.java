package org.sensepitch.ipgeo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/**
 * @author Jens Wilke
 */
class HostClassifierTest {

  private final HostClassifier classifier = new HostClassifier();

  @Test
  void ipv4Literal() {
    assertThat(classifier.classify("8.8.8.8")).isEqualTo(Address.parse("8.8.8.8"));
  }

  @Test
  void ipv4Literal_surroundingWhitespaceIgnored() {
    assertThat(classifier.classify("  1.2.3.4 ")).isEqualTo(Address.parse("1.2.3.4"));
  }

  @Test
  void ipv6Literal_normalizedToCanonicalForm() {
    QueryTarget target = classifier.classify("2001:0DB8:0000:0000:0000:0000:0000:0001");
    assertThat(target).isInstanceOf(Address.class);
    assertThat(target.toString()).isEqualTo("2001:db8::1");
  }

  @Test
  void bracketedIpv6() {
    assertThat(classifier.classify("[2001:4860:4860::8888]"))
        .isEqualTo(Address.parse("2001:4860:4860::8888"));
  }

  @Test
  void zonedIpv6_zoneDropped() {
    assertThat(classifier.classify("fe80::1%eth0")).isEqualTo(Address.parse("fe80::1"));
    assertThat(classifier.classify("[fe80::1%25]")).isEqualTo(Address.parse("fe80::1"));
  }

  @Test
  void ipv4MappedIpv6_isIpv4() {
    QueryTarget target = classifier.classify("::ffff:1.2.3.4");
    assertThat(target).isEqualTo(Address.parse("1.2.3.4"));
    assertThat(((Address) target).isIpv4()).isTrue();
  }

  @Test
  void hostname_lowerCasedAndTrailingDotRemoved() {
    assertThat(classifier.classify("WWW.Example.COM.")).isEqualTo(new Hostname("www.example.com"));
  }

  @Test
  void hostname_underscoreAndDigitsAllowed() {
    assertThat(classifier.classify("_dmarc.1und1.de")).isEqualTo(new Hostname("_dmarc.1und1.de"));
  }

  @Test
  void hostname_internationalizedConvertedToAscii() {
    assertThat(classifier.classify("例子.中国"))
        .isInstanceOf(Hostname.class)
        .hasToString("xn--fsqu00a.xn--fiqs8s");
  }

  @Test
  void singleLabelHostname() {
    assertThat(classifier.classify("localhost")).isEqualTo(new Hostname("localhost"));
  }

  @Test
  void emptyOrBlank_invalid() {
    assertThatThrownBy(() -> classifier.classify(null)).isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("")).isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("   ")).isInstanceOf(InvalidHostException.class);
  }

  @Test
  void numericNonIpv4_invalid() {
    assertThatThrownBy(() -> classifier.classify("1.2.3.999"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("1.2.3"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("12345"))
        .isInstanceOf(InvalidHostException.class);
  }

  @Test
  void brokenIpv6_invalid() {
    assertThatThrownBy(() -> classifier.classify("2001:db8::1::2"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("[2001:db8::1"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("[1.2.3.4]"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("fe80::1%"))
        .isInstanceOf(InvalidHostException.class);
  }

  @Test
  void illegalCharacters_invalid() {
    assertThatThrownBy(() -> classifier.classify("exa mple.com"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("example.com/path"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("-example.com"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("example-.com"))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("example..com"))
        .isInstanceOf(InvalidHostException.class);
  }

  @Test
  void tooLong_invalid() {
    String label = "a".repeat(63);
    String name = String.join(".", label, label, label, "b".repeat(61));
    assertThat(name).hasSize(253);
    assertThat(classifier.classify(name)).isInstanceOf(Hostname.class);
    assertThat(classifier.classify(name + ".")).isInstanceOf(Hostname.class);
    assertThatThrownBy(() -> classifier.classify("x" + name))
        .isInstanceOf(InvalidHostException.class);
    assertThatThrownBy(() -> classifier.classify("a".repeat(64) + ".com"))
        .isInstanceOf(InvalidHostException.class);
  }

  @Test
  void invalidHost_carriesStableCode() {
    assertThatThrownBy(() -> classifier.classify("a b"))
        .isInstanceOfSatisfying(
            InvalidHostException.class, e -> assertThat(e.code()).isEqualTo("INVALID_HOST"));
  }
}
