package io.reqtrace.platform.domain.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RequestTokenTest {

  @Test
  void rendersPlainAndKeyValue() {
    assertThat(new RequestToken("abc123", TokenFormat.PLAIN).render()).isEqualTo("abc123");
    assertThat(new RequestToken("abc123", TokenFormat.KEY_VALUE).render())
        .isEqualTo("request_id=abc123");
  }

  @Test
  void rejectsNonHexDigest() {
    assertThatThrownBy(() -> new RequestToken("ABC", TokenFormat.PLAIN))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RequestToken("a=b", TokenFormat.PLAIN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNulls() {
    assertThatThrownBy(() -> new RequestToken(null, TokenFormat.PLAIN))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> new RequestToken("abc", null))
        .isInstanceOf(NullPointerException.class);
  }
}
