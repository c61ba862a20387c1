package io.hookline.sign;

import io.hookline.ConfigurationException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Signs and verifies webhook bodies with HMAC-SHA256.
 *
 * <p>The signed base string is {@code "{timestamp}.{rawBody}"} and the signature header
 * value is {@code "v1=" + lowercase hex}. Receivers verify by recomputing the HMAC over the
 * same base string with their copy of the signing secret.
 *
 * <p>This class is thread-safe.
 */
public final class WebhookSigner {
  public static final String SCHEME = "v1=";
  public static final long DEFAULT_TOLERANCE_SECONDS = 300;

  static final String ALGORITHM = "HmacSHA256";

  private final Clock clock;
  private final long toleranceSeconds;
  private final String algorithm;

  public WebhookSigner() {
    this(Clock.systemUTC(), DEFAULT_TOLERANCE_SECONDS);
  }

  /**
   * @param clock            source of "now" for tolerance checks
   * @param toleranceSeconds maximum accepted distance between a timestamp and now
   * @throws ConfigurationException if the JVM has no {@code HmacSHA256} provider
   */
  public WebhookSigner(Clock clock, long toleranceSeconds) {
    this(clock, toleranceSeconds, ALGORITHM);
  }

  WebhookSigner(Clock clock, long toleranceSeconds, String algorithm) {
    if (toleranceSeconds < 0) {
      throw new IllegalArgumentException("toleranceSeconds must be >= 0, got: " + toleranceSeconds);
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.toleranceSeconds = toleranceSeconds;
    this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    try {
      Mac.getInstance(algorithm);
    } catch (NoSuchAlgorithmException e) {
      throw new ConfigurationException(algorithm + " is not available in this JVM", e);
    }
  }

  /**
   * Computes the signature header value for a body sent at {@code timestamp}.
   *
   * @param secret    the subscription's signing secret
   * @param timestamp seconds since the epoch, as sent in {@code X-Webhook-Timestamp}
   * @param rawBody   the exact request body
   * @return {@code "v1=" + hex(HMAC-SHA256(secret, timestamp + "." + rawBody))}
   */
  public String sign(String secret, long timestamp, String rawBody) {
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(rawBody, "rawBody");
    return SCHEME + HexFormat.of().formatHex(hmac(secret, timestamp + "." + rawBody));
  }

  /**
   * Verifies a signature using the configured tolerance.
   *
   * @see #verify(String, long, String, String, long)
   */
  public boolean verify(String secret, long timestamp, String rawBody, String candidate) {
    return verify(secret, timestamp, rawBody, candidate, toleranceSeconds);
  }

  /**
   * Returns {@code true} only if {@code timestamp} is within {@code toleranceSeconds} of now
   * and {@code candidate} equals the expected signature. The comparison is constant-time.
   * Null or malformed candidates never verify.
   */
  public boolean verify(String secret, long timestamp, String rawBody, String candidate,
      long toleranceSeconds) {
    if (secret == null || rawBody == null || candidate == null || !candidate.startsWith(SCHEME)) {
      return false;
    }
    long now = clock.instant().getEpochSecond();
    if (!withinTolerance(now, timestamp, toleranceSeconds)) {
      return false;
    }
    byte[] expected = sign(secret, timestamp, rawBody).getBytes(StandardCharsets.UTF_8);
    byte[] provided = candidate.getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expected, provided);
  }

  public long toleranceSeconds() {
    return toleranceSeconds;
  }

  private static boolean withinTolerance(long now, long timestamp, long toleranceSeconds) {
    long distance;
    try {
      distance = Math.absExact(Math.subtractExact(now, timestamp));
    } catch (ArithmeticException e) {
      // too far from now to be representable
      return false;
    }
    return distance <= toleranceSeconds;
  }

  private byte[] hmac(String secret, String data) {
    try {
      Mac mac = Mac.getInstance(algorithm);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
      return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new ConfigurationException("Failed to initialise " + algorithm, e);
    }
  }
}
