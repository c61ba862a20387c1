package io.hookline.intake;

import io.hookline.model.EventEnvelope;

/**
 * Result of {@link EventIntake#trigger}.
 *
 * @param event                the stored event
 * @param matchedSubscriptions active subscriptions listening to the event type
 * @param queuedDeliveries     delivery tasks accepted by the dispatcher queue
 */
public record TriggerReceipt(EventEnvelope event, int matchedSubscriptions, int queuedDeliveries) {
}
