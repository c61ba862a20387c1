package io.hookline.server.web;

import io.hookline.model.SubscriptionPatch;
import io.hookline.model.SubscriptionStatus;
import io.hookline.model.VerificationMode;

import java.util.List;
import java.util.Map;

/**
 * PATCH body. Absent fields are left unchanged.
 */
public record UpdateWebhookRequest(
    String url,
    List<String> events,
    String status,
    String verificationType,
    Map<String, Object> metadata
) {

  SubscriptionPatch toPatch() {
    return new SubscriptionPatch(
        url,
        events,
        status != null ? SubscriptionStatus.fromCode(status) : null,
        verificationType != null ? VerificationMode.fromCode(verificationType) : null,
        metadata);
  }
}
