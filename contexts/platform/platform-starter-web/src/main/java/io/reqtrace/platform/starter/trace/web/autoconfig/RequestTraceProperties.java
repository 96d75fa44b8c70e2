package io.reqtrace.platform.starter.trace.web.autoconfig;

import io.reqtrace.platform.domain.token.TokenFormat;
import io.reqtrace.platform.http.filters.RequestTraceFilter;
import io.reqtrace.platform.http.logging.Slf4jTraceLogSink;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.event.Level;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request tracing settings (prefix: {@code reqtrace.web.trace}).
 *
 * <p>Controls the filter shape (logging, scope release, token format) and where lines go.
 */
@Validated
@ConfigurationProperties(prefix = "reqtrace.web.trace")
public class RequestTraceProperties {

  private boolean enabled = true;

  /** Emit "new request" / "done" lines. */
  private boolean logging = true;

  /**
   * Release the per-request scope entry after the chain. Disabling leaks one entry per request
   * until released elsewhere.
   */
  private boolean releaseScope = true;

  @NotNull private TokenFormat tokenFormat = TokenFormat.PLAIN;

  @NotNull private Level logLevel = Level.INFO;

  private String loggerName = Slf4jTraceLogSink.DEFAULT_LOGGER_NAME;

  /** MDC key mirroring the token; blank disables mirroring. */
  private String mdcKey = RequestTraceFilter.DEFAULT_MDC_KEY;

  /** Response header echoing the token; blank disables the echo. */
  private String responseHeader = "";

  @NotEmpty private List<String> urlPatterns = new ArrayList<>(List.of("/*"));

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isLogging() {
    return logging;
  }

  public void setLogging(boolean logging) {
    this.logging = logging;
  }

  public boolean isReleaseScope() {
    return releaseScope;
  }

  public void setReleaseScope(boolean releaseScope) {
    this.releaseScope = releaseScope;
  }

  public TokenFormat getTokenFormat() {
    return tokenFormat;
  }

  public void setTokenFormat(TokenFormat tokenFormat) {
    this.tokenFormat = (tokenFormat == null) ? TokenFormat.PLAIN : tokenFormat;
  }

  public Level getLogLevel() {
    return logLevel;
  }

  public void setLogLevel(Level logLevel) {
    this.logLevel = (logLevel == null) ? Level.INFO : logLevel;
  }

  public String getLoggerName() {
    return loggerName;
  }

  public void setLoggerName(String loggerName) {
    this.loggerName = loggerName;
  }

  public String getMdcKey() {
    return mdcKey;
  }

  public void setMdcKey(String mdcKey) {
    this.mdcKey = mdcKey;
  }

  public String getResponseHeader() {
    return responseHeader;
  }

  public void setResponseHeader(String responseHeader) {
    this.responseHeader = responseHeader;
  }

  public List<String> getUrlPatterns() {
    return urlPatterns;
  }

  public void setUrlPatterns(List<String> urlPatterns) {
    this.urlPatterns = urlPatterns;
  }
}
