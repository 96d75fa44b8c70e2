package io.reqtrace.platform.http.scope;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletRequestWrapper;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RequestScopeStore} backed by a {@link ConcurrentHashMap} keyed by request identity.
 *
 * <p>Concurrency:
 *
 * <ul>
 *   <li>Reads are lock-free.
 *   <li>Structural changes lock only the hash bin of the affected request, so requests do not
 *       contend with each other beyond bin collisions.
 *   <li>{@link #bind} and {@link #release} for the same request are atomic with respect to each
 *       other; the last write wins.
 * </ul>
 *
 * <p>Every operation unwraps {@link ServletRequestWrapper}s and keys on the innermost request, so a
 * wrapper and the request it decorates share one entry: binding, reading, unbinding or releasing
 * through either affects the same bindings.
 */
public final class ConcurrentRequestScopeStore implements RequestScopeStore {

  private final ConcurrentHashMap<RequestKey, Map<String, Object>> entries =
      new ConcurrentHashMap<>();

  @Override
  public void bind(ServletRequest request, String key, Object value) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    entries.compute(
        keyOf(request),
        (k, bindings) -> {
          Map<String, Object> target = (bindings != null) ? bindings : new ConcurrentHashMap<>();
          target.put(key, value);
          return target;
        });
  }

  @Override
  public Optional<Object> get(ServletRequest request, String key) {
    if (request == null || key == null) {
      return Optional.empty();
    }
    Map<String, Object> bindings = entries.get(keyOf(request));
    return (bindings == null) ? Optional.empty() : Optional.ofNullable(bindings.get(key));
  }

  @Override
  public void unbind(ServletRequest request, String key) {
    if (request == null || key == null) {
      return;
    }
    entries.computeIfPresent(
        keyOf(request),
        (k, bindings) -> {
          bindings.remove(key);
          return bindings.isEmpty() ? null : bindings;
        });
  }

  @Override
  public void release(ServletRequest request) {
    if (request != null) {
      entries.remove(keyOf(request));
    }
  }

  @Override
  public int size() {
    return entries.size();
  }

  /** Key of the innermost request beneath any wrappers. */
  private static RequestKey keyOf(ServletRequest request) {
    ServletRequest current = request;
    while (current instanceof ServletRequestWrapper wrapper) {
      current = wrapper.getRequest();
    }
    return new RequestKey(current);
  }

  /** Reference-equality key; never consults the request's own equals/hashCode. */
  private static final class RequestKey {
    private final ServletRequest request;
    private final int hash;

    RequestKey(ServletRequest request) {
      this.request = request;
      this.hash = System.identityHashCode(request);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof RequestKey other && other.request == request;
    }

    @Override
    public int hashCode() {
      return hash;
    }
  }
}
