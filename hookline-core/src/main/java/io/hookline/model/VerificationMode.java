package io.hookline.model;

import io.hookline.ValidationException;

/**
 * Endpoint ownership handshake run before a subscription is activated.
 */
public enum VerificationMode {
  NONE("none"),
  STRIPE_STYLE("stripe-style"),
  SLACK_STYLE("slack-style");

  private final String code;

  VerificationMode(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean requiresHandshake() {
    return this != NONE;
  }

  /**
   * Resolves a mode from its wire code. Accepts the short aliases {@code stripe} and
   * {@code slack}. A {@code null} or blank code maps to {@link #STRIPE_STYLE}.
   *
   * @throws ValidationException if the code is unknown
   */
  public static VerificationMode fromCode(String code) {
    if (code == null || code.isBlank()) {
      return STRIPE_STYLE;
    }
    String normalized = code.trim().toLowerCase();
    return switch (normalized) {
      case "none" -> NONE;
      case "stripe", "stripe-style", "stripe_style" -> STRIPE_STYLE;
      case "slack", "slack-style", "slack_style" -> SLACK_STYLE;
      default -> throw new ValidationException("Unknown verification type: " + code);
    };
  }
}
