package io.reqtrace.platform.http.filters;

import io.reqtrace.platform.domain.token.RequestToken;
import io.reqtrace.platform.domain.token.RequestTokenGenerator;
import io.reqtrace.platform.domain.token.TokenFormat;
import io.reqtrace.platform.http.logging.RequestTokens;
import io.reqtrace.platform.http.logging.TraceLog;
import io.reqtrace.platform.http.response.StatusRecordingResponse;
import io.reqtrace.platform.http.scope.RequestScopeStore;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Assigns every request a correlation token and logs its start and completion.
 *
 * <p>Per request:
 *
 * <ol>
 *   <li>Generates a token from URL, remote address and the current instant.
 *   <li>Binds it to the request in the {@link RequestScopeStore} (and mirrors it into the {@link
 *       MDC} when an MDC key is configured).
 *   <li>Logs {@code new request <METHOD> <URL>}.
 *   <li>Runs the chain exactly once with a {@link StatusRecordingResponse}.
 *   <li>Logs {@code done, status: <code> <reason> time: <elapsed>}.
 *   <li>Releases the scope entry.
 * </ol>
 *
 * <p>{@link Variant} switches logging and release on or off. Non-logging variants pass the
 * original response through untouched.
 *
 * <p>Failure policy: exceptions from the chain are never suppressed. Logging variants write a
 * {@code failed, status: ... time: ... error: ...} line before rethrowing; releasing variants
 * release the entry on every path. When the request goes async, completion logging and release
 * move to {@link AsyncListener#onComplete}.
 *
 * <p>Variants that do not release ({@link Variant#NO_RELEASE}, {@link
 * Variant#NO_LOG_NO_RELEASE}) leave one entry per request in the store. That is a slow leak
 * proportional to request volume, accepted for long-lived connections where this filter cannot know
 * when handling really ends; the owner must call {@link RequestScopeStore#release} itself.
 *
 * <p>Error dispatches are filtered too. The token stays on the request under {@link
 * #REQUEST_ATTR_TOKEN}, so an error page rendered after the original dispatch finished is bound to
 * the same token instead of a fresh one.
 */
@Order(RequestTraceFilter.ORDER)
public final class RequestTraceFilter extends OncePerRequestFilter {

  /** Run first so that every later filter sees the token. */
  public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

  /** Default MDC key for the mirrored token. */
  public static final String DEFAULT_MDC_KEY = "requestId";

  /**
   * Request attribute exposing the {@link RequestToken} to downstream handlers. It outlives the
   * dispatch so that error dispatches can rebind the same token.
   */
  public static final String REQUEST_ATTR_TOKEN = RequestTraceFilter.class.getName() + ".TOKEN";

  /** Wrapper shapes; each fixes logging and release and suggests a token format. */
  public enum Variant {
    /** Logs start/completion and releases the scope entry. */
    STANDARD(true, true, TokenFormat.PLAIN),
    /** No logging; releases the scope entry. */
    NO_LOG(false, true, TokenFormat.PLAIN),
    /** Logs start/completion; never releases. */
    NO_RELEASE(true, false, TokenFormat.PLAIN),
    /** Neither logs nor releases. */
    NO_LOG_NO_RELEASE(false, false, TokenFormat.PLAIN),
    /** Like {@link #STANDARD} with {@code request_id=} tokens. */
    KEY_VALUE(true, true, TokenFormat.KEY_VALUE);

    private final boolean logging;
    private final boolean release;
    private final TokenFormat defaultFormat;

    Variant(boolean logging, boolean release, TokenFormat defaultFormat) {
      this.logging = logging;
      this.release = release;
      this.defaultFormat = defaultFormat;
    }

    public boolean logging() {
      return logging;
    }

    public boolean release() {
      return release;
    }

    public TokenFormat defaultFormat() {
      return defaultFormat;
    }

    /**
     * Resolves the plain-token variant for a logging/release combination.
     *
     * @param logging whether to log start/completion
     * @param release whether to release the scope entry
     * @return matching variant
     */
    public static Variant of(boolean logging, boolean release) {
      if (logging) {
        return release ? STANDARD : NO_RELEASE;
      }
      return release ? NO_LOG : NO_LOG_NO_RELEASE;
    }
  }

  // ---------------- Configuration (immutable) ----------------

  private final RequestTokenGenerator generator;
  private final RequestTokens tokens;
  private final TraceLog traceLog;
  private final Variant variant;
  private final TokenFormat tokenFormat;
  private final String mdcKey;
  private final String responseHeader;

  private RequestTraceFilter(Builder b) {
    this.generator = b.generator;
    this.tokens = b.traceLog.tokens();
    this.traceLog = b.traceLog;
    this.variant = b.variant;
    this.tokenFormat = (b.tokenFormat != null) ? b.tokenFormat : b.variant.defaultFormat();
    this.mdcKey = blankToNull(b.mdcKey);
    this.responseHeader = blankToNull(b.responseHeader);
  }

  // ---------------- Factories ----------------

  /**
   * Starts a builder.
   *
   * @param traceLog facade used for start/completion lines; its {@link RequestTokens} decide where
   *     the token is bound
   * @return builder with {@link Variant#STANDARD} defaults
   */
  public static Builder builder(TraceLog traceLog) {
    return new Builder(traceLog);
  }

  /** Logs and releases; plain tokens. */
  public static RequestTraceFilter standard(TraceLog traceLog) {
    return builder(traceLog).variant(Variant.STANDARD).build();
  }

  /** Releases without logging. */
  public static RequestTraceFilter noLog(TraceLog traceLog) {
    return builder(traceLog).variant(Variant.NO_LOG).build();
  }

  /** Logs without releasing; see the class notes on leaks. */
  public static RequestTraceFilter noRelease(TraceLog traceLog) {
    return builder(traceLog).variant(Variant.NO_RELEASE).build();
  }

  /** Neither logs nor releases; see the class notes on leaks. */
  public static RequestTraceFilter noLogNoRelease(TraceLog traceLog) {
    return builder(traceLog).variant(Variant.NO_LOG_NO_RELEASE).build();
  }

  /** Logs and releases; {@code request_id=} tokens. */
  public static RequestTraceFilter keyValue(TraceLog traceLog) {
    return builder(traceLog).variant(Variant.KEY_VALUE).build();
  }

  // ---------------- Filter logic ----------------

  @Override
  protected void doFilterInternal(
      @NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response,
      @NonNull FilterChain chain)
      throws ServletException, IOException {

    // 1) Generate (or carry over on error dispatch) + bind before anything downstream runs
    String url = requestUrl(request);
    RequestToken carried = carriedToken(request);
    RequestToken token =
        (carried != null)
            ? carried
            : generator.generate(url, remoteAddress(request), tokenFormat);
    tokens.bind(request, token);
    request.setAttribute(REQUEST_ATTR_TOKEN, token);

    String previousMdc = null;
    if (mdcKey != null) {
      previousMdc = MDC.get(mdcKey);
      MDC.put(mdcKey, token.render());
    }
    if (responseHeader != null) {
      response.setHeader(responseHeader, token.render());
    }

    boolean deferred = false;
    try {
      if (carried != null) {
        if (variant.logging()) {
          traceLog.logln(request, "error dispatch", url);
        }
        deferred = invoke(request, response, chain);
      } else {
        deferred =
            variant.logging()
                ? invokeLogged(request, response, chain, url)
                : invoke(request, response, chain);
      }
    } finally {
      if (mdcKey != null) {
        restoreMdc(previousMdc);
      }
      if (!deferred) {
        finish(request);
      }
    }
  }

  private boolean invoke(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    chain.doFilter(request, response);
    if (request.isAsyncStarted()) {
      request.getAsyncContext().addListener(new CompletionListener(request, null, 0L));
      return true;
    }
    return false;
  }

  private boolean invokeLogged(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain, String url)
      throws ServletException, IOException {
    traceLog.logln(request, "new request", request.getMethod(), url);
    StatusRecordingResponse recorder = new StatusRecordingResponse(response, request);
    long start = System.nanoTime();
    try {
      chain.doFilter(request, recorder);
    } catch (IOException | ServletException | RuntimeException ex) {
      traceLog.logln(
          request,
          "failed, status:",
          failureStatusLine(recorder),
          "time:",
          formatElapsed(System.nanoTime() - start),
          "error:",
          ex);
      throw ex;
    }
    if (request.isAsyncStarted()) {
      request.getAsyncContext().addListener(new CompletionListener(request, recorder, start));
      return true;
    }
    logDone(request, recorder, start);
    return false;
  }

  private void logDone(HttpServletRequest request, StatusRecordingResponse recorder, long start) {
    traceLog.logln(
        request,
        "done, status:",
        recorder.statusLine(),
        "time:",
        formatElapsed(System.nanoTime() - start));
  }

  private void finish(HttpServletRequest request) {
    if (variant.release()) {
      tokens.store().release(request);
    }
  }

  /** Token of the dispatch that raised the error, or {@code null} outside error dispatches. */
  private static RequestToken carriedToken(HttpServletRequest request) {
    if (request.getDispatcherType() != DispatcherType.ERROR) {
      return null;
    }
    Object attr = request.getAttribute(REQUEST_ATTR_TOKEN);
    return (attr instanceof RequestToken token) ? token : null;
  }

  /** Error pages must see the token of the request that failed. */
  @Override
  protected boolean shouldNotFilterErrorDispatch() {
    return false;
  }

  private void restoreMdc(String previous) {
    if (previous == null) {
      MDC.remove(mdcKey);
    } else {
      MDC.put(mdcKey, previous);
    }
  }

  /** Async completion: log and release once the container completes the exchange. */
  private final class CompletionListener implements AsyncListener {
    private final HttpServletRequest request;
    private final StatusRecordingResponse recorder;
    private final long start;

    CompletionListener(HttpServletRequest request, StatusRecordingResponse recorder, long start) {
      this.request = request;
      this.recorder = recorder;
      this.start = start;
    }

    @Override
    public void onComplete(AsyncEvent event) {
      try {
        if (recorder != null) {
          logDone(request, recorder, start);
        }
      } finally {
        finish(request);
      }
    }

    @Override
    public void onTimeout(AsyncEvent event) {
      // container completes afterwards
    }

    @Override
    public void onError(AsyncEvent event) {
      if (recorder != null) {
        traceLog.logln(
            request,
            "failed, status:",
            failureStatusLine(recorder),
            "time:",
            formatElapsed(System.nanoTime() - start),
            "error:",
            event.getThrowable());
      }
    }

    @Override
    public void onStartAsync(AsyncEvent event) {
      event.getAsyncContext().addListener(this);
    }
  }

  // ---------------- Accessors ----------------

  public Variant variant() {
    return variant;
  }

  public TokenFormat tokenFormat() {
    return tokenFormat;
  }

  // ---------------- Helpers ----------------

  /** Request URI plus query string, as sent by the client. */
  static String requestUrl(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String query = request.getQueryString();
    return (query == null || query.isEmpty()) ? uri : uri + "?" + query;
  }

  /** Client {@code host:port}. */
  static String remoteAddress(HttpServletRequest request) {
    return request.getRemoteAddr() + ":" + request.getRemotePort();
  }

  /** Status to report for a failed chain; errors not yet written count as 500. */
  static String failureStatusLine(StatusRecordingResponse recorder) {
    int status = recorder.recordedStatus();
    return StatusRecordingResponse.statusLine(
        status >= 400 ? status : HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
  }

  /** Elapsed time in milliseconds with microsecond precision, e.g. {@code 1.234ms}. */
  static String formatElapsed(long nanos) {
    return String.format(Locale.ROOT, "%.3fms", nanos / 1_000_000.0);
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }

  // ---------------- Builder ----------------

  /** Fluent builder for {@link RequestTraceFilter}. */
  public static final class Builder {
    private final TraceLog traceLog;
    private RequestTokenGenerator generator = new RequestTokenGenerator();
    private Variant variant = Variant.STANDARD;
    private TokenFormat tokenFormat;
    private String mdcKey = DEFAULT_MDC_KEY;
    private String responseHeader;

    private Builder(TraceLog traceLog) {
      this.traceLog = Objects.requireNonNull(traceLog, "traceLog");
    }

    /** Wrapper shape; defaults to {@link Variant#STANDARD}. */
    public Builder variant(Variant variant) {
      this.variant = Objects.requireNonNull(variant, "variant");
      return this;
    }

    /** Overrides the variant's token format. */
    public Builder tokenFormat(TokenFormat tokenFormat) {
      this.tokenFormat = tokenFormat;
      return this;
    }

    /** Token source; defaults to a generator on the system UTC clock. */
    public Builder generator(RequestTokenGenerator generator) {
      this.generator = Objects.requireNonNull(generator, "generator");
      return this;
    }

    /** MDC key mirroring the token; blank disables mirroring. */
    public Builder mdcKey(String mdcKey) {
      this.mdcKey = mdcKey;
      return this;
    }

    /** Response header echoing the token; blank (the default) disables the echo. */
    public Builder responseHeader(String responseHeader) {
      this.responseHeader = responseHeader;
      return this;
    }

    public RequestTraceFilter build() {
      return new RequestTraceFilter(this);
    }
  }
}
