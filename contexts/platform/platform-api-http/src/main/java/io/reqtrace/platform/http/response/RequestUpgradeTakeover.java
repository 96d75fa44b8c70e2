package io.reqtrace.platform.http.response;

import io.reqtrace.platform.domain.error.CapabilityNotSupportedException;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpUpgradeHandler;
import java.io.IOException;
import java.util.Objects;

/**
 * {@link ConnectionTakeover} backed by the container's own upgrade support, {@link
 * HttpServletRequest#upgrade(Class)}.
 *
 * <p>Containers (and test doubles) that cannot upgrade the exchange signal it with {@link
 * UnsupportedOperationException}; that is reported as {@link CapabilityNotSupportedException}.
 */
public final class RequestUpgradeTakeover implements ConnectionTakeover {

  private final HttpServletRequest request;

  public RequestUpgradeTakeover(HttpServletRequest request) {
    this.request = Objects.requireNonNull(request, "request");
  }

  @Override
  public <T extends HttpUpgradeHandler> T upgrade(Class<T> handlerClass)
      throws IOException, ServletException {
    try {
      return request.upgrade(handlerClass);
    } catch (UnsupportedOperationException ex) {
      throw new CapabilityNotSupportedException(CAPABILITY, ex);
    }
  }
}
