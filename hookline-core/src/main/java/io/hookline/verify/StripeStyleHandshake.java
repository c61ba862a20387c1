package io.hookline.verify;

import io.hookline.model.Subscription;
import io.hookline.model.VerificationMode;
import io.hookline.transport.TransportResponse;
import io.hookline.transport.WebhookTransport;
import io.hookline.util.JsonCodec;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sends {@code {"type":"webhook.verification","verification_token":...,"created":...}}
 * and accepts any 2xx answer.
 */
public final class StripeStyleHandshake implements VerificationHandshake {
  static final String TYPE = "webhook.verification";

  private final WebhookTransport transport;
  private final JsonCodec jsonCodec;
  private final Clock clock;
  private final String userAgent;

  public StripeStyleHandshake(WebhookTransport transport, JsonCodec jsonCodec, Clock clock, String userAgent) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
  }

  @Override
  public VerificationMode mode() {
    return VerificationMode.STRIPE_STYLE;
  }

  @Override
  public HandshakeResult perform(Subscription subscription) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", TYPE);
    payload.put("verification_token", subscription.verificationToken());
    payload.put("created", clock.instant().getEpochSecond());

    TransportResponse response;
    try {
      response = HandshakeRequests.post(transport, subscription.url(), userAgent, jsonCodec.toJson(payload));
    } catch (IOException e) {
      return HandshakeResult.failed(subscription, HandshakeRequests.describe(e));
    }
    if (!response.isSuccessful()) {
      return HandshakeResult.failed(subscription, "HTTP " + response.statusCode());
    }
    return HandshakeResult.passed(subscription);
  }
}
