package org.sensepitch.ipgeo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

/**
 * @author Jens Wilke
 */
class HostnameResolverTest {

  private static final Hostname HOST = new Hostname("example.com");

  private final Map<RecordType, CompletableFuture<List<Address>>> answers =
      new EnumMap<>(RecordType.class);

  private final AddressQuery query =
      (hostname, type) -> answers.getOrDefault(type, new CompletableFuture<>());

  private final HostnameResolver resolver = new HostnameResolver(query, Duration.ofMillis(200));

  private void answer(RecordType type, String... addresses) {
    answers.put(
        type,
        CompletableFuture.completedFuture(
            Arrays.stream(addresses).map(Address::parse).toList()));
  }

  private void fail(RecordType type) {
    answers.put(type, CompletableFuture.failedFuture(new RuntimeException("SERVFAIL")));
  }

  private List<Address> resolve() {
    return resolver.resolve(HOST).join();
  }

  @Test
  void ipv4BeforeIpv6_answerOrderKept() {
    answer(RecordType.A, "93.184.216.34", "93.184.216.35");
    answer(RecordType.AAAA, "2606:2800:220:1::248");
    assertThat(resolve())
        .extracting(Address::toString)
        .containsExactly("93.184.216.34", "93.184.216.35", "2606:2800:220:1::248");
  }

  @Test
  void duplicatesRemoved() {
    answer(RecordType.A, "1.1.1.1", "1.0.0.1", "1.1.1.1");
    answer(RecordType.AAAA, "::ffff:1.0.0.1");
    assertThat(resolve()).extracting(Address::toString).containsExactly("1.1.1.1", "1.0.0.1");
  }

  @Test
  void onlyIpv6() {
    answer(RecordType.A);
    answer(RecordType.AAAA, "2001:db8::1");
    assertThat(resolve()).extracting(Address::toString).containsExactly("2001:db8::1");
  }

  @Test
  void oneQueryFails_otherAnswerUsed() {
    fail(RecordType.A);
    answer(RecordType.AAAA, "2001:db8::1");
    assertThat(resolve()).extracting(Address::toString).containsExactly("2001:db8::1");
  }

  @Test
  void queryThrowsSynchronously_otherAnswerUsed() {
    answer(RecordType.A, "192.0.2.7");
    AddressQuery throwing =
        (hostname, type) -> {
          if (type == RecordType.AAAA) {
            throw new IllegalStateException("resolver closed");
          }
          return answers.get(type);
        };
    List<Address> result =
        new HostnameResolver(throwing, Duration.ofMillis(200)).resolve(HOST).join();
    assertThat(result).extracting(Address::toString).containsExactly("192.0.2.7");
  }

  @Test
  void bothFail_noSuchHost() {
    fail(RecordType.A);
    fail(RecordType.AAAA);
    assertThatThrownBy(this::resolve)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(NoSuchHostException.class);
  }

  @Test
  void noRecords_noSuchHost() {
    answer(RecordType.A);
    answer(RecordType.AAAA);
    assertThatThrownBy(this::resolve).hasCauseInstanceOf(NoSuchHostException.class);
  }

  @Test
  void timeout_noSuchHost() {
    // no answers registered, both queries never complete
    assertThatThrownBy(this::resolve).hasCauseInstanceOf(NoSuchHostException.class);
  }

  @Test
  void slowQuery_otherAnswerUsedAfterTimeout() {
    answer(RecordType.A, "198.51.100.1");
    assertThat(resolve()).extracting(Address::toString).containsExactly("198.51.100.1");
  }
}
