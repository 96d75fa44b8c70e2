package io.reqtrace.platform.domain.error;

/**
 * Error kinds raised by request tracing.
 *
 * <p>Each kind carries a stable kebab-case slug (safe for logs and metrics tags) and a short
 * human-readable title.
 */
public enum TraceErrorKind {

  /** Connection takeover requested on a response that cannot provide it. */
  CAPABILITY_NOT_SUPPORTED("capability-not-supported", "Capability Not Supported"),

  /** Bound token does not split into exactly one {@code key=value} pair. */
  MALFORMED_TOKEN("malformed-token", "Malformed Request Token");

  private final String slug;
  private final String title;

  TraceErrorKind(String slug, String title) {
    this.slug = slug;
    this.title = title;
  }

  public String slug() {
    return slug;
  }

  public String title() {
    return title;
  }
}
