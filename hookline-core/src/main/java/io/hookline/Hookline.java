package io.hookline;

import io.hookline.dispatch.DeliveryDispatcher;
import io.hookline.dispatch.DeliveryObserver;
import io.hookline.dispatch.ExponentialBackoffRetryPolicy;
import io.hookline.dispatch.RetryPolicy;
import io.hookline.intake.EventIntake;
import io.hookline.model.Subscription;
import io.hookline.registry.SubscriptionRegistry;
import io.hookline.registry.TargetUrlValidator;
import io.hookline.retention.RetentionScheduler;
import io.hookline.sign.SecretGenerator;
import io.hookline.sign.WebhookSigner;
import io.hookline.spi.ConnectionProvider;
import io.hookline.spi.EventPurger;
import io.hookline.spi.EventStore;
import io.hookline.spi.MetricsExporter;
import io.hookline.spi.SubscriptionStore;
import io.hookline.transport.OkHttpWebhookTransport;
import io.hookline.transport.WebhookTransport;
import io.hookline.util.JsonCodec;
import io.hookline.verify.CoordinatorSubscriptionListener;
import io.hookline.verify.HandshakeCoordinator;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the registry, intake, dispatcher, handshake coordinator
 * and (optionally) the retention scheduler into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Hookline hookline = Hookline.builder()
 *     .connectionProvider(connectionProvider)
 *     .subscriptionStore(subscriptionStore)
 *     .eventStore(eventStore)
 *     .build()) {
 *   Subscription sub = hookline.registry().create(
 *       "https://example.com/hooks", List.of("order.created"), VerificationMode.NONE, null);
 *   hookline.intake().trigger("order.created", "{\"orderId\":\"o1\"}");
 * }
 * }</pre>
 *
 * @see Hookline.Builder
 */
public final class Hookline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Hookline.class.getName());

  private final SubscriptionRegistry registry;
  private final EventIntake intake;
  private final DeliveryDispatcher dispatcher;
  private final HandshakeCoordinator coordinator;
  private final RetentionScheduler retentionScheduler;
  private final WebhookSigner signer;
  private final WebhookTransport ownedTransport;
  private final MetricsExporter metrics;

  private Hookline(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    Objects.requireNonNull(builder.eventStore, "eventStore");

    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    JsonCodec jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    SecretGenerator secrets = new SecretGenerator();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.signer = new WebhookSigner(clock, builder.signatureToleranceSeconds);

    WebhookTransport transport = builder.transport;
    if (transport == null) {
      transport = OkHttpWebhookTransport.builder()
          .callTimeout(builder.requestTimeout)
          .readTimeout(builder.requestTimeout)
          .build();
      this.ownedTransport = transport;
    } else {
      this.ownedTransport = null;
    }

    this.registry = SubscriptionRegistry.builder()
        .connectionProvider(builder.connectionProvider)
        .store(builder.subscriptionStore)
        .secrets(secrets)
        .urlValidator(new TargetUrlValidator(builder.allowPrivateTargets))
        .failureCeiling(builder.failureCeiling)
        .clock(clock)
        .build();

    DeliveryDispatcher.Builder dispatcherBuilder = DeliveryDispatcher.builder()
        .registry(registry)
        .connectionProvider(builder.connectionProvider)
        .eventStore(builder.eventStore)
        .transport(transport)
        .signer(signer)
        .retryPolicy(builder.retryPolicy)
        .maxAttempts(builder.maxAttempts)
        .workerCount(builder.workerCount)
        .queueCapacity(builder.queueCapacity)
        .enqueueTimeoutMs(builder.enqueueTimeoutMs)
        .drainTimeoutMs(builder.drainTimeoutMs)
        .userAgent(builder.userAgent)
        .metrics(metrics)
        .clock(clock);
    builder.observers.forEach(dispatcherBuilder::observer);
    this.dispatcher = dispatcherBuilder.build();

    this.coordinator = HandshakeCoordinator.builder()
        .registry(registry)
        .transport(transport)
        .jsonCodec(jsonCodec)
        .secrets(secrets)
        .metrics(metrics)
        .clock(clock)
        .userAgent(builder.userAgent)
        .threads(builder.handshakeThreads)
        .build();

    this.intake = EventIntake.builder()
        .connectionProvider(builder.connectionProvider)
        .eventStore(builder.eventStore)
        .registry(registry)
        .dispatcher(dispatcher)
        .jsonCodec(jsonCodec)
        .metrics(metrics)
        .clock(clock)
        .build();

    registry.addListener(new CoordinatorSubscriptionListener(coordinator));

    if (builder.eventPurger != null) {
      this.retentionScheduler = RetentionScheduler.builder()
          .connectionProvider(builder.connectionProvider)
          .purger(builder.eventPurger)
          .registry(registry)
          .eventRetention(builder.eventRetention)
          .pendingVerificationTimeout(builder.pendingVerificationTimeout)
          .batchSize(builder.purgeBatchSize)
          .intervalSeconds(builder.purgeIntervalSeconds)
          .clock(clock)
          .build();
      retentionScheduler.start();
    } else {
      this.retentionScheduler = null;
    }
    logger.fine("Hookline started");
  }

  public static Builder builder() {
    return new Builder();
  }

  public SubscriptionRegistry registry() {
    return registry;
  }

  public EventIntake intake() {
    return intake;
  }

  public DeliveryDispatcher dispatcher() {
    return dispatcher;
  }

  public HandshakeCoordinator coordinator() {
    return coordinator;
  }

  public WebhookSigner signer() {
    return signer;
  }

  /**
   * @return the retention scheduler, or {@code null} when no purger was configured
   */
  public RetentionScheduler retentionScheduler() {
    return retentionScheduler;
  }

  /**
   * Resets a subscription via {@link SubscriptionRegistry#retry}, then hands its most recent
   * undelivered event back to the dispatcher. The receipt names that event only when the
   * dispatcher actually queued it.
   *
   * @throws SubscriptionNotFoundException if no subscription has this id
   */
  public RetryReceipt retry(String subscriptionId) {
    Subscription retried = registry.retry(subscriptionId);
    String eventId = retried.lastFailedEventId();
    boolean queued = eventId != null && retried.isActive() && dispatcher.manualRetry(subscriptionId);
    return new RetryReceipt(retried, queued ? eventId : null);
  }

  /**
   * Shuts down components in order: retention scheduler, handshake coordinator,
   * dispatcher, then the transport (if created here) and the metrics exporter (if
   * closeable).
   */
  @Override
  public void close() {
    List<AutoCloseable> components = new ArrayList<>();
    if (retentionScheduler != null) {
      components.add(retentionScheduler);
    }
    components.add(coordinator);
    components.add(dispatcher);
    if (ownedTransport != null) {
      components.add(ownedTransport);
    }
    if (metrics instanceof AutoCloseable closeable) {
      components.add(closeable);
    }

    RuntimeException first = null;
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new HooklineException("Close failed", e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Hookline}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore subscriptionStore;
    private EventStore eventStore;
    private EventPurger eventPurger;
    private WebhookTransport transport;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy();
    private JsonCodec jsonCodec;
    private Clock clock;
    private final List<DeliveryObserver> observers = new ArrayList<>();
    private int maxAttempts = 5;
    private int workerCount = 4;
    private int queueCapacity = 1000;
    private long enqueueTimeoutMs = 100;
    private long drainTimeoutMs = 5000;
    private Duration requestTimeout = Duration.ofSeconds(10);
    private String userAgent;
    private int failureCeiling = 10;
    private boolean allowPrivateTargets;
    private long signatureToleranceSeconds = WebhookSigner.DEFAULT_TOLERANCE_SECONDS;
    private int handshakeThreads = 2;
    private Duration eventRetention = Duration.ofDays(90);
    private Duration pendingVerificationTimeout = Duration.ofDays(30);
    private int purgeBatchSize = 500;
    private long purgeIntervalSeconds = 86_400;

    private Builder() {}

    /** <p><b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Enables the retention scheduler.
     *
     * <p>Optional. Without a purger events are kept forever.
     */
    public Builder eventPurger(EventPurger eventPurger) {
      this.eventPurger = eventPurger;
      return this;
    }

    /**
     * Optional. Defaults to an {@link OkHttpWebhookTransport} using {@link #requestTimeout},
     * closed together with this instance.
     */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder observer(DeliveryObserver observer) {
      this.observers.add(Objects.requireNonNull(observer, "observer"));
      return this;
    }

    /** Optional. Defaults to {@code 5}. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Optional. Defaults to {@code 4}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder enqueueTimeoutMs(long enqueueTimeoutMs) {
      this.enqueueTimeoutMs = enqueueTimeoutMs;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the hard timeout of deliveries and handshakes made by the default transport.
     *
     * <p>Optional. Defaults to {@code 10 seconds}.
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    /** Optional. Defaults to {@code 10}. */
    public Builder failureCeiling(int failureCeiling) {
      this.failureCeiling = failureCeiling;
      return this;
    }

    /**
     * Allows loopback and private-network targets. Meant for tests and local development.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder allowPrivateTargets(boolean allowPrivateTargets) {
      this.allowPrivateTargets = allowPrivateTargets;
      return this;
    }

    /** Optional. Defaults to {@code 300}. */
    public Builder signatureToleranceSeconds(long signatureToleranceSeconds) {
      this.signatureToleranceSeconds = signatureToleranceSeconds;
      return this;
    }

    public Builder handshakeThreads(int handshakeThreads) {
      this.handshakeThreads = handshakeThreads;
      return this;
    }

    /** Optional. Defaults to {@code 90 days}. */
    public Builder eventRetention(Duration eventRetention) {
      this.eventRetention = Objects.requireNonNull(eventRetention, "eventRetention");
      return this;
    }

    /** Optional. Defaults to {@code 30 days}. */
    public Builder pendingVerificationTimeout(Duration pendingVerificationTimeout) {
      this.pendingVerificationTimeout = Objects.requireNonNull(pendingVerificationTimeout,
          "pendingVerificationTimeout");
      return this;
    }

    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    public Builder purgeIntervalSeconds(long purgeIntervalSeconds) {
      this.purgeIntervalSeconds = purgeIntervalSeconds;
      return this;
    }

    /**
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if a limit is out of range
     * @throws ConfigurationException   if HMAC-SHA256 is unavailable
     */
    public Hookline build() {
      return new Hookline(this);
    }
  }
}
