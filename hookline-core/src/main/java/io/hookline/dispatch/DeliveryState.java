package io.hookline.dispatch;

/**
 * States of a {@link DeliveryTask}:
 * {@code QUEUED -> IN_FLIGHT -> {DELIVERED | RETRY_SCHEDULED | EXHAUSTED}}.
 * A task whose subscription is no longer active when its turn comes, or that cannot be
 * queued, is {@code PARKED} on the subscription for a manual retry.
 */
public enum DeliveryState {
  QUEUED,
  IN_FLIGHT,
  DELIVERED,
  RETRY_SCHEDULED,
  EXHAUSTED,
  PARKED;

  public boolean isTerminal() {
    return this == DELIVERED || this == EXHAUSTED || this == PARKED;
  }
}
