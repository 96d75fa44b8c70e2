package io.reqtrace.platform.http.scope;

import jakarta.servlet.ServletRequest;
import java.util.Optional;

/**
 * Associates key/value state with a single in-flight request.
 *
 * <p>Bindings are keyed by request <em>identity</em>, never by request content: two concurrent
 * requests cannot observe each other's bindings even if their values coincide.
 *
 * <p>Implementations must be safe for concurrent use by unboundedly many requests. {@link #get}
 * must never block. Bindings that are never {@linkplain #release released} stay in the store for
 * the process lifetime.
 */
public interface RequestScopeStore {

  /**
   * Binds {@code value} to {@code request} under {@code key}, replacing any prior value.
   *
   * @param request owning request
   * @param key binding key
   * @param value value to bind (non-null)
   */
  void bind(ServletRequest request, String key, Object value);

  /**
   * Returns the value bound to {@code request} under {@code key}.
   *
   * @param request owning request
   * @param key binding key
   * @return bound value, or empty if none
   */
  Optional<Object> get(ServletRequest request, String key);

  /**
   * Removes a single binding; the request entry is dropped once it holds no bindings.
   *
   * @param request owning request
   * @param key binding key
   */
  void unbind(ServletRequest request, String key);

  /**
   * Removes every binding held for {@code request}.
   *
   * @param request owning request
   */
  void release(ServletRequest request);

  /**
   * Number of requests currently holding at least one binding.
   *
   * @return live request entries
   */
  int size();
}
