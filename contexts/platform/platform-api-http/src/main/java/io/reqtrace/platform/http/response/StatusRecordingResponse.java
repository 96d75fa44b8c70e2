package io.reqtrace.platform.http.response;

import io.reqtrace.platform.domain.error.CapabilityNotSupportedException;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.ServletResponseWrapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;
import jakarta.servlet.http.HttpUpgradeHandler;
import java.io.IOException;
import java.util.Optional;
import org.springframework.http.HttpStatus;

/**
 * Response wrapper that records the status code sent downstream.
 *
 * <p>Every call is forwarded unchanged to the wrapped response; headers and body are never
 * buffered, so streaming and server-sent events behave exactly as without the wrapper. The status
 * is captured from {@link #setStatus}, {@link #sendError} and {@link #sendRedirect}. When nothing
 * sets it explicitly the recorded status is {@code 200}, matching what the container sends when the
 * body is first flushed.
 *
 * <p>Connection takeover goes to the first response in the wrapped chain that implements {@link
 * ConnectionTakeover}. Failing that, a recorder created with its request falls back to the
 * container's {@link HttpServletRequest#upgrade}. With neither, {@link #upgrade} fails with {@link
 * CapabilityNotSupportedException}.
 *
 * <p>One instance per request; not shared across threads other than the request's own.
 */
public class StatusRecordingResponse extends HttpServletResponseWrapper {

  private final HttpServletRequest request;
  private volatile int status;

  public StatusRecordingResponse(HttpServletResponse response) {
    this(response, null);
  }

  /**
   * Creates a recorder whose takeover falls back to {@code request}'s container upgrade.
   *
   * @param response response to wrap
   * @param request exchange's request, or {@code null} for response-chain lookup only
   */
  public StatusRecordingResponse(HttpServletResponse response, HttpServletRequest request) {
    super(response);
    this.request = request;
  }

  // ---------------- Status capture ----------------

  @Override
  public void setStatus(int sc) {
    this.status = sc;
    super.setStatus(sc);
  }

  @Override
  public void sendError(int sc) throws IOException {
    this.status = sc;
    super.sendError(sc);
  }

  @Override
  public void sendError(int sc, String msg) throws IOException {
    this.status = sc;
    super.sendError(sc, msg);
  }

  @Override
  public void sendRedirect(String location) throws IOException {
    this.status = HttpServletResponse.SC_FOUND;
    super.sendRedirect(location);
  }

  /** Clears the recorded status along with the wrapped response's. */
  @Override
  public void reset() {
    super.reset();
    this.status = 0;
  }

  /**
   * Returns the recorded status code, {@code 200} if none was set.
   *
   * @return status code
   */
  public int recordedStatus() {
    int sc = status;
    return (sc == 0) ? HttpServletResponse.SC_OK : sc;
  }

  /**
   * Returns whether a status was set explicitly.
   *
   * @return {@code true} once any status-setting method was called
   */
  public boolean isStatusSet() {
    return status != 0;
  }

  /**
   * Human-readable status for logging, e.g. {@code "404 Not Found"}.
   *
   * @return code and reason phrase, or the bare code when the reason is unknown
   */
  public String statusLine() {
    return statusLine(recordedStatus());
  }

  /**
   * Formats a status code as {@code "<code> <reason>"}.
   *
   * @param code HTTP status code
   * @return code and reason phrase, or the bare code when the reason is unknown
   */
  public static String statusLine(int code) {
    HttpStatus known = HttpStatus.resolve(code);
    return (known == null) ? Integer.toString(code) : code + " " + known.getReasonPhrase();
  }

  // ---------------- Capability forwarding ----------------

  /**
   * Looks up the connection takeover capability of the wrapped response chain.
   *
   * @return the capability, or empty if neither a wrapped response nor the request provides it
   */
  public Optional<ConnectionTakeover> takeover() {
    ServletResponse current = getResponse();
    while (current != null) {
      if (current instanceof ConnectionTakeover capable) {
        return Optional.of(capable);
      }
      if (current instanceof ServletResponseWrapper wrapper) {
        current = wrapper.getResponse();
      } else {
        break;
      }
    }
    if (request == null) {
      return Optional.empty();
    }
    return Optional.of(new RequestUpgradeTakeover(request));
  }

  /**
   * Hands the connection over through {@link #takeover()}.
   *
   * <p>On success the recorded status becomes {@code 101 Switching Protocols}.
   *
   * @param handlerClass upgrade handler type
   * @param <T> handler type
   * @return handler now owning the connection
   * @throws CapabilityNotSupportedException if nothing in the exchange can take over
   * @throws IOException on I/O failure during the switch
   * @throws ServletException if the handler cannot be instantiated
   */
  public <T extends HttpUpgradeHandler> T upgrade(Class<T> handlerClass)
      throws IOException, ServletException {
    ConnectionTakeover capability =
        takeover()
            .orElseThrow(() -> new CapabilityNotSupportedException(ConnectionTakeover.CAPABILITY));
    T handler = capability.upgrade(handlerClass);
    this.status = HttpServletResponse.SC_SWITCHING_PROTOCOLS;
    return handler;
  }
}
