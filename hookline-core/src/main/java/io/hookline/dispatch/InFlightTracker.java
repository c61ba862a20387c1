package io.hookline.dispatch;

/**
 * Tracks delivery tasks that are queued, running or waiting for a retry, keyed by
 * {@code eventId:subscriptionId}.
 */
public interface InFlightTracker {
  boolean tryAcquire(String key);

  void release(String key);

  int size();
}
