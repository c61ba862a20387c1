package io.hookline.model;

/**
 * Optional criteria for listing subscriptions. A {@code null} field matches everything.
 *
 * <p>The {@code event} criterion matches subscriptions whose event set contains that
 * literal event type or the wildcard {@code *}.
 */
public record SubscriptionFilter(SubscriptionStatus status, String event) {

  public static final SubscriptionFilter ALL = new SubscriptionFilter(null, null);

  public static SubscriptionFilter activeFor(String eventType) {
    return new SubscriptionFilter(SubscriptionStatus.ACTIVE, eventType);
  }

  public boolean matches(Subscription subscription) {
    if (status != null && subscription.status() != status) {
      return false;
    }
    return event == null || subscription.listensTo(event);
  }
}
