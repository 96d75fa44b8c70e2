package io.reqtrace.platform.starter.trace.web.autoconfig;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.util.ContextInitializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LoggingInitializationContext;
import org.springframework.boot.logging.logback.LogbackLoggingSystem;
import org.springframework.mock.env.MockEnvironment;

class LogbackDefaultsTest {

  private static final String INCLUDING_CONFIG = "classpath:reqtrace-logback-include.xml";

  private final LogbackLoggingSystem loggingSystem =
      new LogbackLoggingSystem(getClass().getClassLoader());

  @AfterEach
  void restoreTestLogging() throws Exception {
    loggingSystem.cleanUp();
    LoggerContext context = loggerContext();
    context.reset();
    new ContextInitializer(context).autoConfig();
  }

  @Test
  void routesDefaultLoggerName() {
    initialize(new MockEnvironment());

    assertThat(traceAppenderOn("reqtrace")).isTrue();
  }

  @Test
  void followsConfiguredLoggerName() {
    initialize(new MockEnvironment().withProperty("reqtrace.web.trace.logger-name", "audit.trace"));

    assertThat(traceAppenderOn("audit.trace")).isTrue();
    assertThat(traceAppenderOn("reqtrace")).isFalse();
  }

  private void initialize(MockEnvironment environment) {
    loggingSystem.beforeInitialize();
    loggingSystem.initialize(
        new LoggingInitializationContext(environment), INCLUDING_CONFIG, null);
  }

  private static boolean traceAppenderOn(String loggerName) {
    Logger logger = loggerContext().getLogger(loggerName);
    return logger.getAppender("REQTRACE_CONSOLE") != null && !logger.isAdditive();
  }

  private static LoggerContext loggerContext() {
    return (LoggerContext) LoggerFactory.getILoggerFactory();
  }
}
