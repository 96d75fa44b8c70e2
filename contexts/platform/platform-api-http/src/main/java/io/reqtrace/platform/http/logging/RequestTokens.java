package io.reqtrace.platform.http.logging;

import io.reqtrace.platform.domain.error.MalformedTokenException;
import io.reqtrace.platform.domain.token.RequestToken;
import io.reqtrace.platform.domain.token.TokenFormat;
import io.reqtrace.platform.http.scope.RequestScopeStore;
import jakarta.servlet.ServletRequest;
import java.util.Objects;
import java.util.Optional;

/**
 * Binds and reads the correlation token of a request.
 *
 * <p>Typical use inside a handler:
 *
 * <pre>{@code
 * response.setHeader("X-Request-Token", tokens.token(request));
 * }</pre>
 */
public final class RequestTokens {

  /** Scope key the token is bound under. */
  public static final String TOKEN_KEY = "_token";

  private final RequestScopeStore store;

  public RequestTokens(RequestScopeStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Binds the rendered token to the request, replacing any previous token.
   *
   * @param request owning request
   * @param token token to bind
   */
  public void bind(ServletRequest request, RequestToken token) {
    store.bind(request, TOKEN_KEY, token.render());
  }

  /**
   * Returns the token as bound, including the {@code request_id=} label in key-value mode.
   *
   * @param request request to look up
   * @return bound token, or {@code ""} if none
   */
  public String token(ServletRequest request) {
    return lookup(request).orElse("");
  }

  /**
   * Returns the token without its key-value label.
   *
   * @param request request to look up
   * @return the value part of {@code request_id=<value>}, or {@code ""} if no token is bound
   * @throws MalformedTokenException if the bound token does not split on {@code =} into exactly two
   *     parts (plain-format tokens included)
   */
  public String tokenPlain(ServletRequest request) {
    Optional<String> bound = lookup(request);
    if (bound.isEmpty()) {
      return "";
    }
    String token = bound.get();
    String[] parts = token.split(String.valueOf(TokenFormat.SEPARATOR), -1);
    if (parts.length != 2) {
      throw new MalformedTokenException(token);
    }
    return parts[1];
  }

  public RequestScopeStore store() {
    return store;
  }

  private Optional<String> lookup(ServletRequest request) {
    return store.get(request, TOKEN_KEY).filter(String.class::isInstance).map(String.class::cast);
  }
}
