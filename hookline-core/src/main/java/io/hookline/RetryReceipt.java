package io.hookline;

import io.hookline.model.Subscription;

/**
 * Result of {@link Hookline#retry(String)}.
 *
 * @param subscription    the subscription after the reset
 * @param requeuedEventId the undelivered event handed back to the dispatcher, or
 *                        {@code null} if there was nothing to re-send
 */
public record RetryReceipt(Subscription subscription, String requeuedEventId) {

  public boolean requeued() {
    return requeuedEventId != null;
  }
}
