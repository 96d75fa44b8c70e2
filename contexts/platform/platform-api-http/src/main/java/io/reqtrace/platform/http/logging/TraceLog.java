package io.reqtrace.platform.http.logging;

import jakarta.servlet.ServletRequest;
import java.util.Objects;
import org.slf4j.event.Level;

/**
 * Logging facade that prefixes each line with the request's correlation token.
 *
 * <p>Three joining disciplines are offered:
 *
 * <ul>
 *   <li>{@link #log}: operands concatenated, with a space between two operands only when neither
 *       is a {@link CharSequence}.
 *   <li>{@link #logln}: operands always space-separated.
 *   <li>{@link #logf}: {@link String#format} with the token as the first field.
 * </ul>
 *
 * <p>The token is always its own space-separated first field. A missing token renders as an empty
 * first field; it is never an error. Instances are
 * immutable; {@link #at(Level)} derives a facade for another level.
 */
public final class TraceLog {

  private final RequestTokens tokens;
  private final TraceLogSink sink;
  private final Level level;

  public TraceLog(RequestTokens tokens, TraceLogSink sink) {
    this(tokens, sink, Level.INFO);
  }

  public TraceLog(RequestTokens tokens, TraceLogSink sink, Level level) {
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.level = Objects.requireNonNull(level, "level");
  }

  /**
   * Returns a facade writing at {@code level}, sharing tokens and sink with this one.
   *
   * @param level target level
   * @return facade for that level
   */
  public TraceLog at(Level level) {
    return (level == this.level) ? this : new TraceLog(tokens, sink, level);
  }

  public Level level() {
    return level;
  }

  public RequestTokens tokens() {
    return tokens;
  }

  /**
   * Logs the operands, token first, joined like {@code print}.
   *
   * @param request request whose token prefixes the line
   * @param vals operands
   */
  public void log(ServletRequest request, Object... vals) {
    if (sink.isEnabled(level)) {
      sink.write(level, join(tokens.token(request), vals));
    }
  }

  /**
   * Logs the operands, token first, separated by single spaces.
   *
   * @param request request whose token prefixes the line
   * @param vals operands
   */
  public void logln(ServletRequest request, Object... vals) {
    if (sink.isEnabled(level)) {
      sink.write(level, joinSpaced(tokens.token(request), vals));
    }
  }

  /**
   * Logs a formatted line; the token is prepended as {@code "%s "}.
   *
   * @param request request whose token prefixes the line
   * @param format {@link java.util.Formatter} pattern
   * @param args format arguments
   */
  public void logf(ServletRequest request, String format, Object... args) {
    if (!sink.isEnabled(level)) {
      return;
    }
    Object[] all = new Object[(args == null ? 0 : args.length) + 1];
    all[0] = tokens.token(request);
    if (args != null) {
      System.arraycopy(args, 0, all, 1, args.length);
    }
    sink.write(level, String.format("%s " + format, all));
  }

  // ---------------- Joining ----------------

  static String join(String token, Object[] vals) {
    StringBuilder sb = new StringBuilder(token);
    if (vals == null || vals.length == 0) {
      return sb.toString();
    }
    sb.append(' ').append(vals[0]);
    for (int i = 1; i < vals.length; i++) {
      if (!(vals[i - 1] instanceof CharSequence) && !(vals[i] instanceof CharSequence)) {
        sb.append(' ');
      }
      sb.append(vals[i]);
    }
    return sb.toString();
  }

  static String joinSpaced(String token, Object[] vals) {
    StringBuilder sb = new StringBuilder(token);
    if (vals != null) {
      for (Object v : vals) {
        sb.append(' ').append(v);
      }
    }
    return sb.toString();
  }
}
