package io.hookline.util;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Random hex identifiers and secrets drawn from a shared {@link SecureRandom}.
 */
public final class Ids {
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  public static final String SUBSCRIPTION_PREFIX = "wh_";
  public static final String EVENT_PREFIX = "evt_";

  private Ids() {}

  /** {@code wh_} followed by 32 hex characters. */
  public static String subscriptionId() {
    return SUBSCRIPTION_PREFIX + randomHex(16);
  }

  /** {@code evt_} followed by 32 hex characters. */
  public static String eventId() {
    return EVENT_PREFIX + randomHex(16);
  }

  /**
   * Returns {@code byteCount} random bytes as lowercase hex ({@code 2 * byteCount} chars).
   */
  public static String randomHex(int byteCount) {
    byte[] bytes = new byte[byteCount];
    RANDOM.nextBytes(bytes);
    return HEX.formatHex(bytes);
  }
}
