package io.reqtrace.platform.domain.token;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RequestTokenGeneratorTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private final RequestTokenGenerator generator = new RequestTokenGenerator();

  @Test
  void digestIsMd5OfUrlRemoteAddressAndInstant() {
    RequestToken token = generator.generate("/foo", "1.2.3.4:5", T0, TokenFormat.PLAIN);

    assertThat(token.digest()).isEqualTo("d7dca928d87b44d115dfa560dee4f909");
    assertThat(token.render()).isEqualTo("d7dca928d87b44d115dfa560dee4f909");
  }

  @Test
  void sameInputsProduceSameDigest() {
    RequestToken a = generator.generate("/foo", "1.2.3.4:5", T0, TokenFormat.PLAIN);
    RequestToken b = generator.generate("/foo", "1.2.3.4:5", T0, TokenFormat.PLAIN);

    assertThat(a).isEqualTo(b);
  }

  @Test
  void distinctInstantsProduceDistinctTokens() {
    RequestToken a = generator.generate("/foo", "1.2.3.4:5", T0, TokenFormat.PLAIN);
    RequestToken b =
        generator.generate("/foo", "1.2.3.4:5", T0.plusNanos(1_000), TokenFormat.PLAIN);

    assertThat(a.render()).isNotEqualTo(b.render());
  }

  @Test
  void keyValueFormatCarriesLabel() {
    RequestToken token = generator.generate("/foo", "1.2.3.4:5", T0, TokenFormat.KEY_VALUE);

    assertThat(token.render()).isEqualTo("request_id=d7dca928d87b44d115dfa560dee4f909");
    assertThat(token.toString()).isEqualTo(token.render());
  }

  @Test
  void readsInstantFromConfiguredClock() {
    RequestTokenGenerator fixed = new RequestTokenGenerator(Clock.fixed(T0, ZoneOffset.UTC));

    assertThat(fixed.generate("/foo", "1.2.3.4:5", TokenFormat.PLAIN).digest())
        .isEqualTo("d7dca928d87b44d115dfa560dee4f909");
  }

  @Test
  void nullCoordinatesAreTreatedAsEmpty() {
    RequestToken token = generator.generate(null, null, T0, TokenFormat.PLAIN);

    assertThat(token.digest()).hasSize(32).matches("[0-9a-f]{32}");
  }

  @Test
  void nanosecondApartInstantsNeverCollide() {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 1_000; i++) {
      Instant at = Instant.ofEpochSecond(0, i);
      seen.add(generator.generate("/foo", "1.2.3.4:5", at, TokenFormat.PLAIN).render());
    }

    assertThat(seen).hasSize(1_000);
  }
}
