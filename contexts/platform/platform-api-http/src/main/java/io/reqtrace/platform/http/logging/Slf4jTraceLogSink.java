package io.reqtrace.platform.http.logging;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * {@link TraceLogSink} writing through an SLF4J logger.
 *
 * <p>The timestamp comes from the backend layout (see {@code reqtrace/logback-defaults.xml}).
 */
public final class Slf4jTraceLogSink implements TraceLogSink {

  /** Logger name used when none is configured. */
  public static final String DEFAULT_LOGGER_NAME = "reqtrace";

  private final Logger logger;

  public Slf4jTraceLogSink() {
    this(DEFAULT_LOGGER_NAME);
  }

  public Slf4jTraceLogSink(String loggerName) {
    this(
        LoggerFactory.getLogger(
            (loggerName == null || loggerName.isBlank())
                ? DEFAULT_LOGGER_NAME
                : loggerName.trim()));
  }

  public Slf4jTraceLogSink(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public boolean isEnabled(Level level) {
    return logger.isEnabledForLevel(level);
  }

  @Override
  public void write(Level level, String line) {
    logger.atLevel(level).log(line);
  }

  public Logger logger() {
    return logger;
  }
}
