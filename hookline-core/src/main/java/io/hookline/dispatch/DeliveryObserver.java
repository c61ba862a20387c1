package io.hookline.dispatch;

/**
 * Receives delivery state transitions from {@link DeliveryDispatcher}.
 *
 * <p>Callbacks run on dispatcher threads and must not block. Exceptions are logged and
 * ignored.
 */
@FunctionalInterface
public interface DeliveryObserver {

  /**
   * @param task   the task that changed state
   * @param state  the new state
   * @param detail failure detail for {@code RETRY_SCHEDULED}, {@code EXHAUSTED} and
   *               {@code PARKED}; {@code null} otherwise
   */
  void onTransition(DeliveryTask task, DeliveryState state, String detail);
}
