package io.reqtrace.platform.domain.token;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable per-request correlation token.
 *
 * <p>Holds the raw hex digest and the {@link TokenFormat} it is rendered with. Tokens are created
 * once per request by {@link RequestTokenGenerator} and never mutated.
 *
 * @param digest lowercase hex digest (32 chars for MD5)
 * @param format rendering shape
 */
public record RequestToken(String digest, TokenFormat format) implements Serializable {

  @Serial private static final long serialVersionUID = 1L;

  private static final Pattern HEX = Pattern.compile("^[0-9a-f]+$");

  /**
   * Compact canonical constructor; validates the digest.
   *
   * @throws NullPointerException if any argument is null
   * @throws IllegalArgumentException if {@code digest} is not lowercase hex
   */
  public RequestToken {
    Objects.requireNonNull(digest, "digest");
    Objects.requireNonNull(format, "format");
    if (!HEX.matcher(digest).matches()) {
      throw new IllegalArgumentException("Token digest must be lowercase hex: '" + digest + "'");
    }
  }

  /**
   * Returns the token as it is bound to the request and written to logs.
   *
   * @return {@code digest} or {@code request_id=digest}
   */
  public String render() {
    return format.render(digest);
  }

  @Override
  public String toString() {
    return render();
  }
}
