package io.reqtrace.platform.http.logging;

import org.slf4j.event.Level;

/** Destination for token-prefixed log lines. */
public interface TraceLogSink {

  /**
   * Returns whether a line at {@code level} would be written; lets callers skip formatting.
   *
   * @param level log level
   * @return {@code true} if enabled
   */
  boolean isEnabled(Level level);

  /**
   * Writes one line.
   *
   * @param level log level
   * @param line fully formatted line (token first)
   */
  void write(Level level, String line);
}
