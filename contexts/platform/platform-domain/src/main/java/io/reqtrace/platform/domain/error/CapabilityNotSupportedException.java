package io.reqtrace.platform.domain.error;

import java.io.Serial;

/** Raised when an optional response capability (e.g. connection takeover) is absent. */
public final class CapabilityNotSupportedException extends RequestTraceException {

  @Serial private static final long serialVersionUID = 1L;

  private final String capability;

  public CapabilityNotSupportedException(String capability) {
    this(capability, null);
  }

  public CapabilityNotSupportedException(String capability, Throwable cause) {
    super(TraceErrorKind.CAPABILITY_NOT_SUPPORTED, capability + " not supported", cause);
    this.capability = capability;
  }

  public String capability() {
    return capability;
  }
}
