package io.reqtrace.platform.domain.error;

import java.io.Serial;
import java.util.Objects;

/**
 * Base unchecked exception for request tracing failures.
 *
 * <p>Failures are local and synchronous: they surface immediately to the caller and are never
 * retried or silently recovered.
 */
public class RequestTraceException extends RuntimeException {

  @Serial private static final long serialVersionUID = 1L;

  private final TraceErrorKind kind;

  public RequestTraceException(TraceErrorKind kind, String detail) {
    this(kind, detail, null);
  }

  public RequestTraceException(TraceErrorKind kind, String detail, Throwable cause) {
    super(Objects.requireNonNullElse(detail, Objects.requireNonNull(kind, "kind").title()), cause);
    this.kind = kind;
  }

  /**
   * Returns the error kind.
   *
   * @return kind (never {@code null})
   */
  public TraceErrorKind kind() {
    return kind;
  }
}
