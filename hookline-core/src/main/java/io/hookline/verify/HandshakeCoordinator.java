package io.hookline.verify;

import io.hookline.HooklineException;
import io.hookline.SubscriptionNotFoundException;
import io.hookline.ValidationException;
import io.hookline.dispatch.WebhookHeaders;
import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionStatus;
import io.hookline.model.VerificationMode;
import io.hookline.registry.SubscriptionRegistry;
import io.hookline.sign.SecretGenerator;
import io.hookline.spi.MetricsExporter;
import io.hookline.transport.WebhookTransport;
import io.hookline.util.DaemonThreadFactory;
import io.hookline.util.JsonCodec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs verification handshakes and feeds their results into the registry.
 *
 * <p>A successful handshake activates the subscription; a failed one leaves it in
 * {@code pending-verification} with {@code lastHandshakeError} set. Handshakes are not
 * retried automatically. Results for a subscription whose URL changed, or that left the
 * pending state while the handshake ran, are discarded by the registry.
 *
 * <p>Asynchronous handshakes run on a small bounded executor.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class HandshakeCoordinator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HandshakeCoordinator.class.getName());

  private final SubscriptionRegistry registry;
  private final Map<VerificationMode, VerificationHandshake> handshakes;
  private final MetricsExporter metrics;
  private final ThreadPoolExecutor executor;

  private HandshakeCoordinator(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    WebhookTransport transport = Objects.requireNonNull(builder.transport, "transport");
    if (builder.threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1");
    }
    if (builder.queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be >= 1");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    JsonCodec jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    SecretGenerator secrets = builder.secrets != null ? builder.secrets : new SecretGenerator();
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    String userAgent = builder.userAgent != null ? builder.userAgent : WebhookHeaders.DEFAULT_USER_AGENT;

    this.handshakes = new EnumMap<>(VerificationMode.class);
    handshakes.put(VerificationMode.STRIPE_STYLE, new StripeStyleHandshake(transport, jsonCodec, clock, userAgent));
    handshakes.put(VerificationMode.SLACK_STYLE, new SlackStyleHandshake(transport, jsonCodec, secrets, userAgent));
    for (VerificationHandshake custom : builder.customHandshakes) {
      if (!custom.mode().requiresHandshake()) {
        throw new IllegalArgumentException("Cannot register a handshake for mode " + custom.mode().code());
      }
      handshakes.put(custom.mode(), custom);
    }

    this.executor = new ThreadPoolExecutor(builder.threads, builder.threads, 60, TimeUnit.SECONDS,
        new ArrayBlockingQueue<>(builder.queueCapacity), new DaemonThreadFactory("hookline-handshake-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the handshake for a pending subscription on the calling thread.
   *
   * @throws SubscriptionNotFoundException if no subscription has this id
   * @throws ValidationException           if the subscription is not awaiting verification
   */
  public HandshakeResult verify(String subscriptionId) {
    Subscription subscription = registry.get(subscriptionId);
    if (subscription.status() != SubscriptionStatus.PENDING_VERIFICATION
        || !subscription.verificationMode().requiresHandshake()) {
      throw new ValidationException("Subscription " + subscriptionId + " is not awaiting verification (status="
          + subscription.status().code() + ")");
    }
    VerificationHandshake handshake = handshakes.get(subscription.verificationMode());
    HandshakeResult result = handshake.perform(subscription);
    if (result.verified()) {
      metrics.incrementHandshakeSuccess();
      registry.markVerified(subscriptionId, result.url());
      logger.log(Level.INFO, "Subscription {0} verified ({1})",
          new Object[]{subscriptionId, subscription.verificationMode().code()});
    } else {
      metrics.incrementHandshakeFailure();
      registry.recordHandshakeFailure(subscriptionId, result.url(), result.error());
      logger.log(Level.INFO, "Verification of {0} failed: {1}", new Object[]{subscriptionId, result.error()});
    }
    return result;
  }

  /**
   * Schedules {@link #verify} on the handshake executor.
   *
   * <p>When the executor queue is full the handshake is not run; the failure is recorded on
   * the subscription and the returned future completes exceptionally.
   */
  public CompletableFuture<HandshakeResult> verifyAsync(String subscriptionId) {
    try {
      return CompletableFuture.supplyAsync(() -> verifyLogged(subscriptionId), executor);
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Handshake queue full; not verifying {0}", subscriptionId);
      registry.find(subscriptionId).ifPresent(s ->
          registry.recordHandshakeFailure(s.id(), s.url(), "Handshake queue full; retry verification"));
      return CompletableFuture.failedFuture(e);
    }
  }

  private HandshakeResult verifyLogged(String subscriptionId) {
    try {
      return verify(subscriptionId);
    } catch (HooklineException e) {
      logger.log(Level.FINE, "Skipped handshake for " + subscriptionId + ": " + e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Handshake for " + subscriptionId + " failed unexpectedly", e);
      throw e;
    }
  }

  /** Stops accepting handshakes and waits briefly for running ones. */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link HandshakeCoordinator}. */
  public static final class Builder {
    private SubscriptionRegistry registry;
    private WebhookTransport transport;
    private JsonCodec jsonCodec;
    private SecretGenerator secrets;
    private MetricsExporter metrics;
    private Clock clock;
    private String userAgent;
    private int threads = 2;
    private int queueCapacity = 100;
    private final List<VerificationHandshake> customHandshakes = new ArrayList<>();

    private Builder() {}

    /** <p><b>Required.</b> */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder secrets(SecretGenerator secrets) {
      this.secrets = secrets;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    /** Optional. Defaults to {@code 2}. */
    public Builder threads(int threads) {
      this.threads = threads;
      return this;
    }

    /** Optional. Defaults to {@code 100}. */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /** Replaces the built-in handshake for {@code handshake.mode()}. */
    public Builder handshake(VerificationHandshake handshake) {
      this.customHandshakes.add(Objects.requireNonNull(handshake, "handshake"));
      return this;
    }

    public HandshakeCoordinator build() {
      return new HandshakeCoordinator(this);
    }
  }
}
