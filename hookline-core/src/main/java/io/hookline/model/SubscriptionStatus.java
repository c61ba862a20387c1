package io.hookline.model;

import io.hookline.ValidationException;

/**
 * Lifecycle status of a webhook subscription. Only {@link #ACTIVE} subscriptions
 * receive deliveries.
 */
public enum SubscriptionStatus {
  PENDING_VERIFICATION("pending-verification"),
  ACTIVE("active"),
  DISABLED("disabled"),
  FAILED("failed");

  private final String code;

  SubscriptionStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a status from its wire code, e.g. {@code "pending-verification"}.
   *
   * @throws ValidationException if the code is unknown
   */
  public static SubscriptionStatus fromCode(String code) {
    for (SubscriptionStatus status : values()) {
      if (status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
        return status;
      }
    }
    throw new ValidationException("Unknown subscription status: " + code);
  }
}
