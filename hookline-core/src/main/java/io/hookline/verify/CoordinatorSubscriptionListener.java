package io.hookline.verify;

import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionStatus;
import io.hookline.registry.SubscriptionListener;

import java.util.Objects;

/**
 * Starts a handshake when a subscription is created pending, and again whenever an update
 * re-arms it (new verification token).
 */
public final class CoordinatorSubscriptionListener implements SubscriptionListener {
  private final HandshakeCoordinator coordinator;

  public CoordinatorSubscriptionListener(HandshakeCoordinator coordinator) {
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
  }

  @Override
  public void afterCreate(Subscription created) {
    if (awaitsHandshake(created)) {
      coordinator.verifyAsync(created.id());
    }
  }

  @Override
  public void afterUpdate(Subscription before, Subscription after) {
    if (awaitsHandshake(after) && !Objects.equals(before.verificationToken(), after.verificationToken())) {
      coordinator.verifyAsync(after.id());
    }
  }

  private static boolean awaitsHandshake(Subscription subscription) {
    return subscription.status() == SubscriptionStatus.PENDING_VERIFICATION
        && subscription.verificationMode().requiresHandshake();
  }
}
