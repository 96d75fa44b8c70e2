package io.reqtrace.platform.starter.trace.web.autoconfig;

import static jakarta.servlet.DispatcherType.ASYNC;
import static jakarta.servlet.DispatcherType.ERROR;
import static jakarta.servlet.DispatcherType.REQUEST;

import io.reqtrace.platform.domain.token.RequestTokenGenerator;
import io.reqtrace.platform.http.filters.RequestTraceFilter;
import io.reqtrace.platform.http.logging.RequestTokens;
import io.reqtrace.platform.http.logging.Slf4jTraceLogSink;
import io.reqtrace.platform.http.logging.TraceLog;
import io.reqtrace.platform.http.logging.TraceLogSink;
import io.reqtrace.platform.http.scope.ConcurrentRequestScopeStore;
import io.reqtrace.platform.http.scope.RequestScopeStore;
import jakarta.servlet.DispatcherType;
import java.util.EnumSet;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.DispatcherServlet;

/**
 * Request tracing wiring for servlet applications.
 *
 * <ul>
 *   <li>{@link RequestScopeStore}, {@link RequestTokens}, {@link TraceLogSink}, {@link TraceLog}
 *       (each replaceable by an application bean)
 *   <li>{@link RequestTraceFilter} registration driven by {@link RequestTraceProperties}
 * </ul>
 *
 * <p>Handlers inject {@link TraceLog} or {@link RequestTokens} to log with, or read, the token of
 * the current request.
 */
@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(DispatcherServlet.class)
@EnableConfigurationProperties(RequestTraceProperties.class)
public class RequestTraceAutoConfiguration {

  private static final EnumSet<DispatcherType> DEFAULT_DISPATCHERS =
      EnumSet.of(REQUEST, ERROR, ASYNC);

  // -----------------------------------------------------------------------------------------------
  // Core components
  // -----------------------------------------------------------------------------------------------

  @Bean
  @ConditionalOnMissingBean
  public RequestScopeStore requestScopeStore() {
    return new ConcurrentRequestScopeStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public RequestTokenGenerator requestTokenGenerator() {
    return new RequestTokenGenerator();
  }

  @Bean
  @ConditionalOnMissingBean
  public RequestTokens requestTokens(RequestScopeStore store) {
    return new RequestTokens(store);
  }

  /** Default sink: SLF4J logger named by {@code reqtrace.web.trace.logger-name}. */
  @Bean
  @ConditionalOnMissingBean
  public TraceLogSink traceLogSink(RequestTraceProperties p) {
    return new Slf4jTraceLogSink(p.getLoggerName());
  }

  @Bean
  @ConditionalOnMissingBean
  public TraceLog traceLog(RequestTokens tokens, TraceLogSink sink, RequestTraceProperties p) {
    return new TraceLog(tokens, sink, p.getLogLevel());
  }

  // -----------------------------------------------------------------------------------------------
  // Filter
  // -----------------------------------------------------------------------------------------------

  /**
   * Registers {@link RequestTraceFilter} with the configured variant and token format.
   *
   * @param p tracing properties
   * @param traceLog facade for start/completion lines
   * @param generator token source
   * @return filter registration bean
   */
  @Bean(name = "requestTraceFilterRegistration")
  @ConditionalOnProperty(prefix = "reqtrace.web.trace", name = "enabled", matchIfMissing = true)
  @ConditionalOnMissingBean(name = "requestTraceFilterRegistration")
  public FilterRegistrationBean<RequestTraceFilter> requestTraceFilter(
      RequestTraceProperties p, TraceLog traceLog, RequestTokenGenerator generator) {
    var filter =
        RequestTraceFilter.builder(traceLog)
            .variant(RequestTraceFilter.Variant.of(p.isLogging(), p.isReleaseScope()))
            .tokenFormat(p.getTokenFormat())
            .generator(generator)
            .mdcKey(p.getMdcKey())
            .responseHeader(p.getResponseHeader())
            .build();
    var reg = new FilterRegistrationBean<>(filter);
    reg.setDispatcherTypes(DEFAULT_DISPATCHERS);
    reg.setOrder(RequestTraceFilter.ORDER);
    reg.setUrlPatterns(p.getUrlPatterns());
    reg.setAsyncSupported(true);
    return reg;
  }
}
