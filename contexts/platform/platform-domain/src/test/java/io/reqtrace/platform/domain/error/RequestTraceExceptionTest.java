package io.reqtrace.platform.domain.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RequestTraceExceptionTest {

  @Test
  void malformedTokenCarriesKindAndToken() {
    MalformedTokenException ex = new MalformedTokenException("a=b=c");

    assertThat(ex.kind()).isEqualTo(TraceErrorKind.MALFORMED_TOKEN);
    assertThat(ex.token()).isEqualTo("a=b=c");
    assertThat(ex).hasMessage("malformed request token: a=b=c");
  }

  @Test
  void capabilityNotSupportedNamesCapability() {
    CapabilityNotSupportedException ex = new CapabilityNotSupportedException("connection takeover");

    assertThat(ex.kind()).isEqualTo(TraceErrorKind.CAPABILITY_NOT_SUPPORTED);
    assertThat(ex.capability()).isEqualTo("connection takeover");
    assertThat(ex).hasMessage("connection takeover not supported");
  }

  @Test
  void blankDetailFallsBackToKindTitle() {
    RequestTraceException ex = new RequestTraceException(TraceErrorKind.MALFORMED_TOKEN, null);

    assertThat(ex).hasMessage("Malformed Request Token");
    assertThat(TraceErrorKind.MALFORMED_TOKEN.slug()).isEqualTo("malformed-token");
  }
}
