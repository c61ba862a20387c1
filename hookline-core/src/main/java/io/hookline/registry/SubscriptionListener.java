package io.hookline.registry;

import io.hookline.model.Subscription;

/**
 * Callbacks fired by {@link SubscriptionRegistry} after a mutation has been stored.
 *
 * <p>Callbacks run on the mutating thread, outside the per-subscription lock. Exceptions
 * are logged and do not affect the mutation or other listeners.
 */
public interface SubscriptionListener {

  /**
   * Called after a subscription has been created.
   *
   * @param created the stored subscription
   */
  default void afterCreate(Subscription created) {
  }

  /**
   * Called after {@link SubscriptionRegistry#update} changed a subscription.
   *
   * @param before state before the update
   * @param after  stored state after the update
   */
  default void afterUpdate(Subscription before, Subscription after) {
  }

  /**
   * Called after {@link SubscriptionRegistry#retry} reset a subscription.
   *
   * @param retried the stored subscription
   */
  default void afterRetry(Subscription retried) {
  }
}
