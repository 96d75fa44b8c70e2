package io.reqtrace.platform.http.response;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpUpgradeHandler;
import java.io.IOException;

/**
 * Optional response capability: hands the underlying connection to a protocol that upgrades past
 * HTTP (websockets, HTTP/2 cleartext, custom framing).
 *
 * <p>Response objects that can perform a takeover implement this interface; {@link
 * RequestUpgradeTakeover} adapts the container's request upgrade to it. Wrappers such as {@link
 * StatusRecordingResponse} never implement it themselves; they look it up on the exchange they
 * wrap.
 */
public interface ConnectionTakeover {

  /** Capability name used in error messages. */
  String CAPABILITY = "connection takeover";

  /**
   * Takes over the connection with an instance of {@code handlerClass}.
   *
   * @param handlerClass upgrade handler type
   * @param <T> handler type
   * @return the handler instance that now owns the connection
   * @throws IOException on I/O failure during the switch
   * @throws ServletException if the handler cannot be instantiated
   */
  <T extends HttpUpgradeHandler> T upgrade(Class<T> handlerClass)
      throws IOException, ServletException;
}
