package io.hookline.sign;

import io.hookline.util.Ids;

/**
 * Generates signing secrets, handshake tokens and slack-style challenges.
 */
public final class SecretGenerator {
  public static final String SECRET_PREFIX = "whsec_";

  /** {@code whsec_} followed by 64 hex characters. */
  public String signingSecret() {
    return SECRET_PREFIX + Ids.randomHex(32);
  }

  /** 64 hex characters. */
  public String verificationToken() {
    return Ids.randomHex(32);
  }

  /** 32 hex characters. */
  public String challenge() {
    return Ids.randomHex(16);
  }
}
