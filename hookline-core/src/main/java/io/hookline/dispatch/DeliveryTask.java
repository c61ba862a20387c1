package io.hookline.dispatch;

import io.hookline.model.EventEnvelope;

import java.util.Objects;

/**
 * One delivery of one event to one subscription.
 *
 * @param event          the event being delivered
 * @param subscriptionId target subscription
 * @param attempt        1-based attempt number
 */
public record DeliveryTask(EventEnvelope event, String subscriptionId, int attempt) {

  public DeliveryTask {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(subscriptionId, "subscriptionId");
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
  }

  public static DeliveryTask first(EventEnvelope event, String subscriptionId) {
    return new DeliveryTask(event, subscriptionId, 1);
  }

  public DeliveryTask nextAttempt() {
    return new DeliveryTask(event, subscriptionId, attempt + 1);
  }

  /** Tracker key, {@code eventId:subscriptionId}. */
  public String key() {
    return event.id() + ":" + subscriptionId;
  }
}
