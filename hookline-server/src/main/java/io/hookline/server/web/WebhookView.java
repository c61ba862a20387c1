package io.hookline.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.hookline.model.Subscription;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON view of a subscription. {@code secret} is only filled in the create response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookView(
    String id,
    String url,
    List<String> events,
    String verificationType,
    String status,
    long deliveryCount,
    int consecutiveFailures,
    Instant lastDeliveryAt,
    String lastDeliveryStatus,
    String lastDeliveryError,
    String lastFailedEventId,
    Instant verifiedAt,
    String lastHandshakeError,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt,
    String secret
) {

  static WebhookView of(Subscription s) {
    return of(s, null);
  }

  static WebhookView withSecret(Subscription s) {
    return of(s, s.signingSecret());
  }

  private static WebhookView of(Subscription s, String secret) {
    return new WebhookView(
        s.id(),
        s.url(),
        s.events(),
        s.verificationMode().code(),
        s.status().code(),
        s.deliveryCount(),
        s.consecutiveFailures(),
        s.lastDeliveryAt(),
        s.lastDeliveryStatus() != null ? s.lastDeliveryStatus().code() : null,
        s.lastDeliveryError(),
        s.lastFailedEventId(),
        s.verifiedAt(),
        s.lastHandshakeError(),
        s.metadata(),
        s.createdAt(),
        s.updatedAt(),
        secret);
  }
}
