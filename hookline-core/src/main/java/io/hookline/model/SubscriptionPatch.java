package io.hookline.model;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a subscription. {@code null} fields are left unchanged.
 * {@code metadata} entries are merged into the existing metadata.
 */
public record SubscriptionPatch(
    String url,
    List<String> events,
    SubscriptionStatus status,
    VerificationMode verificationMode,
    Map<String, Object> metadata
) {

  public static SubscriptionPatch url(String url) {
    return new SubscriptionPatch(url, null, null, null, null);
  }

  public static SubscriptionPatch events(List<String> events) {
    return new SubscriptionPatch(null, events, null, null, null);
  }

  public static SubscriptionPatch status(SubscriptionStatus status) {
    return new SubscriptionPatch(null, null, status, null, null);
  }

  public static SubscriptionPatch verificationMode(VerificationMode mode) {
    return new SubscriptionPatch(null, null, null, mode, null);
  }
}
