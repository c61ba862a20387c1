package io.hookline.model;

import java.time.Instant;

/**
 * Read-only snapshot of a subscription's delivery health.
 */
public record DeliveryStats(
    String subscriptionId,
    long deliveryCount,
    int consecutiveFailures,
    Instant lastDeliveryAt,
    DeliveryStatus lastDeliveryStatus,
    String lastDeliveryError,
    SubscriptionStatus status
) {

  public static DeliveryStats of(Subscription subscription) {
    return new DeliveryStats(
        subscription.id(),
        subscription.deliveryCount(),
        subscription.consecutiveFailures(),
        subscription.lastDeliveryAt(),
        subscription.lastDeliveryStatus(),
        subscription.lastDeliveryError(),
        subscription.status());
  }
}
