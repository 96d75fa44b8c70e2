package io.reqtrace.platform.domain.token;

/**
 * Rendering shape of a {@link RequestToken}.
 *
 * <ul>
 *   <li>{@link #PLAIN}: the bare hex digest, e.g. {@code 9e107d9d372bb6826bd81d3542a419d6}.
 *   <li>{@link #KEY_VALUE}: the digest prefixed with {@code request_id=}, which log parsers
 *       (Splunk, Loki, ...) pick up as a field without extra configuration.
 * </ul>
 */
public enum TokenFormat {
  PLAIN {
    @Override
    public String render(String digest) {
      return digest;
    }
  },
  KEY_VALUE {
    @Override
    public String render(String digest) {
      return KEY_VALUE_LABEL + SEPARATOR + digest;
    }
  };

  /** Label used by {@link #KEY_VALUE}. */
  public static final String KEY_VALUE_LABEL = "request_id";

  /** Separator between label and digest. */
  public static final char SEPARATOR = '=';

  /**
   * Renders the digest in this format.
   *
   * @param digest lowercase hex digest
   * @return rendered token string
   */
  public abstract String render(String digest);
}
