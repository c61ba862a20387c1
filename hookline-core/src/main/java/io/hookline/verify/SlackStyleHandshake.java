package io.hookline.verify;

import io.hookline.model.Subscription;
import io.hookline.model.VerificationMode;
import io.hookline.sign.SecretGenerator;
import io.hookline.transport.TransportResponse;
import io.hookline.transport.WebhookTransport;
import io.hookline.util.JsonCodec;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sends {@code {"type":"url_verification","challenge":...,"token":...}} with a fresh
 * random challenge. The receiver must answer 2xx with a JSON object whose only field is
 * {@code challenge}, equal to the value sent.
 */
public final class SlackStyleHandshake implements VerificationHandshake {
  static final String TYPE = "url_verification";

  private final WebhookTransport transport;
  private final JsonCodec jsonCodec;
  private final SecretGenerator secrets;
  private final String userAgent;

  public SlackStyleHandshake(WebhookTransport transport, JsonCodec jsonCodec, SecretGenerator secrets,
      String userAgent) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.secrets = Objects.requireNonNull(secrets, "secrets");
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
  }

  @Override
  public VerificationMode mode() {
    return VerificationMode.SLACK_STYLE;
  }

  @Override
  public HandshakeResult perform(Subscription subscription) {
    String challenge = secrets.challenge();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", TYPE);
    payload.put("challenge", challenge);
    payload.put("token", subscription.verificationToken());

    TransportResponse response;
    try {
      response = HandshakeRequests.post(transport, subscription.url(), userAgent, jsonCodec.toJson(payload));
    } catch (IOException e) {
      return HandshakeResult.failed(subscription, HandshakeRequests.describe(e));
    }
    if (!response.isSuccessful()) {
      return HandshakeResult.failed(subscription, "HTTP " + response.statusCode());
    }

    Map<String, Object> answer;
    try {
      answer = jsonCodec.parseObject(response.body());
    } catch (IllegalArgumentException e) {
      return HandshakeResult.failed(subscription, "Response is not a JSON object");
    }
    if (!answer.containsKey("challenge")) {
      return HandshakeResult.failed(subscription, "Response is missing the challenge");
    }
    if (answer.size() != 1) {
      return HandshakeResult.failed(subscription, "Response must contain only the challenge");
    }
    if (!challenge.equals(answer.get("challenge"))) {
      return HandshakeResult.failed(subscription, "Challenge mismatch");
    }
    return HandshakeResult.passed(subscription);
  }
}
