package io.hookline.verify;

import io.hookline.model.Subscription;
import io.hookline.model.VerificationMode;

/**
 * One endpoint-ownership protocol. Implementations are stateless and thread-safe.
 *
 * @see StripeStyleHandshake
 * @see SlackStyleHandshake
 */
public interface VerificationHandshake {

  /** The mode this handshake implements. */
  VerificationMode mode();

  /**
   * Challenges the subscription's URL. Never throws for receiver-side problems: timeouts,
   * network errors and wrong answers are reported as a failed result.
   *
   * @param subscription a subscription awaiting verification
   * @return the handshake outcome
   */
  HandshakeResult perform(Subscription subscription);
}
