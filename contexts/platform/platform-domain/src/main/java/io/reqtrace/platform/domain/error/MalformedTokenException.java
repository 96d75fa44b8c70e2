package io.reqtrace.platform.domain.error;

import java.io.Serial;

/**
 * Raised when a plain token is requested but the bound token is not a single {@code key=value}
 * pair.
 */
public final class MalformedTokenException extends RequestTraceException {

  @Serial private static final long serialVersionUID = 1L;

  private final String token;

  public MalformedTokenException(String token) {
    super(TraceErrorKind.MALFORMED_TOKEN, "malformed request token: " + token);
    this.token = token;
  }

  /** The offending token as bound to the request. */
  public String token() {
    return token;
  }
}
