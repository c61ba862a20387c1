package io.hookline;

public final class SubscriptionNotFoundException extends NotFoundException {

  public SubscriptionNotFoundException(String subscriptionId) {
    super("Webhook not found: " + subscriptionId, subscriptionId);
  }
}
