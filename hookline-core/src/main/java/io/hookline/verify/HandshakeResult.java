package io.hookline.verify;

import io.hookline.model.Subscription;

/**
 * Outcome of one verification handshake.
 *
 * @param subscriptionId the subscription being verified
 * @param url            the URL the handshake was sent to
 * @param verified       {@code true} if the receiver proved ownership
 * @param error          failure detail, {@code null} on success
 */
public record HandshakeResult(String subscriptionId, String url, boolean verified, String error) {

  public static HandshakeResult passed(Subscription subscription) {
    return new HandshakeResult(subscription.id(), subscription.url(), true, null);
  }

  public static HandshakeResult failed(Subscription subscription, String error) {
    return new HandshakeResult(subscription.id(), subscription.url(), false, error);
  }
}
