package io.reqtrace.platform.domain.token;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Produces request tokens from request-derived entropy.
 *
 * <p>The digest is MD5 over {@code url + remoteAddress + instant}, rendered as 32 lowercase hex
 * characters. The result is deterministic for the same three inputs; uniqueness per call comes from
 * the instant, which carries the full resolution of the configured {@link Clock}. Uniqueness is
 * probabilistic only (no guarantee under clock skew or adversarial input).
 *
 * <p>Thread-safe via a per-thread {@link MessageDigest}.
 */
public final class RequestTokenGenerator {

  private static final String ALGORITHM = "MD5";
  private static final HexFormat HEX = HexFormat.of();

  private static final ThreadLocal<MessageDigest> DIGEST =
      ThreadLocal.withInitial(RequestTokenGenerator::newDigest);

  private final Clock clock;

  /** Generator reading the system UTC clock. */
  public RequestTokenGenerator() {
    this(Clock.systemUTC());
  }

  /**
   * Generator reading the given clock.
   *
   * @param clock time source for the generation instant
   */
  public RequestTokenGenerator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Generates a token for the given request coordinates at the current instant.
   *
   * @param url request URL (path and query)
   * @param remoteAddress client address, typically {@code host:port}
   * @param format rendering shape
   * @return new token
   */
  public RequestToken generate(String url, String remoteAddress, TokenFormat format) {
    return generate(url, remoteAddress, clock.instant(), format);
  }

  /**
   * Generates a token for the given request coordinates at an explicit instant.
   *
   * @param url request URL (path and query)
   * @param remoteAddress client address, typically {@code host:port}
   * @param instant generation instant
   * @param format rendering shape
   * @return new token
   */
  public RequestToken generate(
      String url, String remoteAddress, Instant instant, TokenFormat format) {
    Objects.requireNonNull(instant, "instant");
    Objects.requireNonNull(format, "format");
    String material = nullToEmpty(url) + nullToEmpty(remoteAddress) + instant;

    MessageDigest md = DIGEST.get();
    md.reset();
    byte[] hash = md.digest(material.getBytes(StandardCharsets.UTF_8));
    return new RequestToken(HEX.formatHex(hash), format);
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      // every JRE must ship MD5
      throw new IllegalStateException("Missing digest algorithm: " + ALGORITHM, e);
    }
  }
}
