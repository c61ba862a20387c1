package io.hookline.dispatch;

import io.hookline.HooklineException;
import io.hookline.StoreException;
import io.hookline.SubscriptionNotFoundException;
import io.hookline.model.DeliveryOutcome;
import io.hookline.model.DeliveryStats;
import io.hookline.model.EventEnvelope;
import io.hookline.model.Subscription;
import io.hookline.registry.SubscriptionRegistry;
import io.hookline.sign.WebhookSigner;
import io.hookline.spi.ConnectionProvider;
import io.hookline.spi.EventStore;
import io.hookline.spi.MetricsExporter;
import io.hookline.transport.TransportResponse;
import io.hookline.transport.WebhookTransport;
import io.hookline.util.DaemonThreadFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded worker pool that delivers signed event payloads to subscriptions.
 *
 * <p>Tasks enter an {@link ArrayBlockingQueue} drained by a fixed number of worker
 * threads. Each attempt re-reads the subscription, signs the body with the current secret
 * and POSTs it through the {@link WebhookTransport}. Every attempt is reported to the
 * {@link SubscriptionRegistry}. Failed attempts are re-queued after a delay from the
 * {@link RetryPolicy} until {@code maxAttempts} is reached.
 *
 * <p>An (event, subscription) pair is held in the {@link InFlightTracker} from the moment
 * it is queued until it is delivered, exhausted or parked, so attempts of one task never
 * overlap and a duplicate enqueue is refused.
 *
 * <p>Tasks that cannot be queued within the enqueue timeout, or whose subscription is no
 * longer active, are parked: the event id is remembered on the subscription so
 * {@link #manualRetry(String)} can pick it up.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see DeliveryDispatcher.Builder
 */
public final class DeliveryDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<DeliveryTask> queue;
  private final ExecutorService workers;
  private final ScheduledExecutorService retryScheduler;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private final SubscriptionRegistry registry;
  private final ConnectionProvider connectionProvider;
  private final EventStore eventStore;
  private final WebhookTransport transport;
  private final WebhookSigner signer;
  private final InFlightTracker inFlightTracker;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final long enqueueTimeoutMs;
  private final long drainTimeoutMs;
  private final String userAgent;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final List<DeliveryObserver> observers = new CopyOnWriteArrayList<>();

  private DeliveryDispatcher(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.signer = builder.signer != null ? builder.signer : new WebhookSigner();
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.userAgent = builder.userAgent != null ? builder.userAgent : WebhookHeaders.DEFAULT_USER_AGENT;
    this.observers.addAll(builder.observers);

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.enqueueTimeoutMs < 0 || builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("Timeouts must be >= 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.enqueueTimeoutMs = builder.enqueueTimeoutMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
    this.retryScheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("hookline-retry-"));

    int workerCount = builder.workerCount;
    if (workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("hookline-delivery-"));
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      // workerCount=0: tasks stay queued (testing only)
      logger.warning("workerCount=0: no delivery workers started; tasks will not be delivered");
      this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("hookline-delivery-"));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public void addObserver(DeliveryObserver observer) {
    observers.add(Objects.requireNonNull(observer, "observer"));
  }

  /**
   * Queues the first attempt of delivering {@code event} to a subscription.
   *
   * @return {@code true} if the task was queued; {@code false} if the dispatcher is closed,
   *     the same (event, subscription) task is already in flight, or the queue stayed full
   *     (in which case the task is parked on the subscription)
   */
  public boolean enqueue(EventEnvelope event, String subscriptionId) {
    DeliveryTask task = DeliveryTask.first(event, subscriptionId);
    if (!accepting.get()) {
      park(task, "Dispatcher is shutting down");
      return false;
    }
    if (!inFlightTracker.tryAcquire(task.key())) {
      logger.log(Level.FINE, "Delivery {0} already in flight", task.key());
      return false;
    }
    if (offer(task)) {
      metrics.incrementDeliveryEnqueued();
      return true;
    }
    inFlightTracker.release(task.key());
    metrics.incrementDeliveryRejected();
    park(task, "Delivery queue full");
    return false;
  }

  /**
   * Re-queues the most recent undelivered event of an active subscription as a fresh task.
   * Other subscriptions are not affected.
   *
   * @return {@code true} if a task was queued
   * @throws SubscriptionNotFoundException if no subscription has this id
   */
  public boolean manualRetry(String subscriptionId) {
    Subscription subscription = registry.get(subscriptionId);
    String eventId = subscription.lastFailedEventId();
    if (eventId == null) {
      logger.log(Level.FINE, "Nothing to retry for subscription {0}", subscriptionId);
      return false;
    }
    if (!subscription.isActive()) {
      logger.log(Level.INFO, "Not retrying {0}: subscription is {1}",
          new Object[]{subscriptionId, subscription.status().code()});
      return false;
    }
    Optional<EventEnvelope> event = loadEvent(eventId);
    if (event.isEmpty()) {
      logger.log(Level.WARNING, "Cannot retry event {0} for {1}: event no longer stored",
          new Object[]{eventId, subscriptionId});
      return false;
    }
    boolean queued = enqueue(event.get(), subscriptionId);
    if (queued) {
      logger.log(Level.INFO, "Re-queued event {0} for subscription {1}", new Object[]{eventId, subscriptionId});
    }
    return queued;
  }

  /**
   * Returns the delivery statistics of a subscription. Pure read.
   *
   * @throws SubscriptionNotFoundException if no subscription has this id
   */
  public DeliveryStats stats(String subscriptionId) {
    return DeliveryStats.of(registry.get(subscriptionId));
  }

  public int queueDepth() {
    return queue.size();
  }

  public int inFlightCount() {
    return inFlightTracker.size();
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private boolean offer(DeliveryTask task) {
    boolean queued;
    try {
      queued = queue.offer(task, enqueueTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      queued = false;
    }
    metrics.recordQueueDepth(queue.size());
    if (queued) {
      notifyObservers(task, DeliveryState.QUEUED, null);
    }
    return queued;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        DeliveryTask task = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (task == null) {
          if (!running.get()) break;
          continue;
        }
        metrics.recordQueueDepth(queue.size());
        process(task);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Delivery loop error", t);
      }
    }
  }

  void process(DeliveryTask task) {
    Optional<Subscription> found;
    try {
      found = registry.find(task.subscriptionId());
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to load subscription " + task.subscriptionId(), e);
      scheduleRetryOrExhaust(task, new DeliveryFailureException(e.getMessage(), e), false);
      return;
    }
    if (found.isEmpty()) {
      logger.log(Level.FINE, "Dropping delivery {0}: subscription deleted", task.key());
      inFlightTracker.release(task.key());
      return;
    }
    Subscription subscription = found.get();
    if (!subscription.isActive()) {
      inFlightTracker.release(task.key());
      park(task, "Subscription is " + subscription.status().code());
      return;
    }

    notifyObservers(task, DeliveryState.IN_FLIGHT, null);
    long start = System.nanoTime();
    try {
      attempt(subscription, task);
      metrics.recordDeliveryDurationMs(elapsedMs(start));
      metrics.incrementDeliverySuccess();
      record(task.subscriptionId(), DeliveryOutcome.success(task.event().id(), clock.instant()));
      inFlightTracker.release(task.key());
      notifyObservers(task, DeliveryState.DELIVERED, null);
    } catch (DeliveryFailureException e) {
      metrics.recordDeliveryDurationMs(elapsedMs(start));
      scheduleRetryOrExhaust(task, e, true);
    }
  }

  private void attempt(Subscription subscription, DeliveryTask task) {
    String body = DeliveryPayloads.toWireJson(task.event());
    long timestamp = clock.instant().getEpochSecond();

    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(WebhookHeaders.CONTENT_TYPE, WebhookHeaders.JSON);
    headers.put(WebhookHeaders.SIGNATURE, signer.sign(subscription.signingSecret(), timestamp, body));
    headers.put(WebhookHeaders.TIMESTAMP, Long.toString(timestamp));
    headers.put(WebhookHeaders.WEBHOOK_ID, subscription.id());
    headers.put(WebhookHeaders.EVENT_ID, task.event().id());
    headers.put(WebhookHeaders.USER_AGENT, userAgent);

    TransportResponse response;
    try {
      response = transport.post(subscription.url(), headers, body);
    } catch (IOException | RuntimeException e) {
      String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      throw new DeliveryFailureException(reason, e);
    }
    if (!response.isSuccessful()) {
      throw new DeliveryFailureException(response.statusCode());
    }
  }

  private void scheduleRetryOrExhaust(DeliveryTask task, DeliveryFailureException failure, boolean counted) {
    boolean exhausted = task.attempt() >= maxAttempts;
    if (counted) {
      metrics.incrementDeliveryFailure();
      record(task.subscriptionId(),
          DeliveryOutcome.failure(task.event().id(), clock.instant(), failure.getMessage(), exhausted));
    }
    if (exhausted) {
      inFlightTracker.release(task.key());
      metrics.incrementDeliveryExhausted();
      if (!counted) {
        park(task, failure.getMessage());
        return;
      }
      logger.log(Level.WARNING, "Delivery {0} exhausted after {1} attempts: {2}",
          new Object[]{task.key(), task.attempt(), failure.getMessage()});
      notifyObservers(task, DeliveryState.EXHAUSTED, failure.getMessage());
      return;
    }

    long delayMs = retryPolicy.computeDelayMs(task.attempt());
    DeliveryTask next = task.nextAttempt();
    try {
      retryScheduler.schedule(() -> requeue(next), delayMs, TimeUnit.MILLISECONDS);
      logger.log(Level.FINE, "Delivery {0} attempt {1} failed ({2}); retrying in {3} ms",
          new Object[]{task.key(), task.attempt(), failure.getMessage(), delayMs});
      notifyObservers(task, DeliveryState.RETRY_SCHEDULED, failure.getMessage());
    } catch (RejectedExecutionException e) {
      inFlightTracker.release(task.key());
      park(next, "Dispatcher is shutting down");
    }
  }

  private void requeue(DeliveryTask next) {
    if (accepting.get() && offer(next)) {
      return;
    }
    inFlightTracker.release(next.key());
    metrics.incrementDeliveryRejected();
    park(next, accepting.get() ? "Delivery queue full" : "Dispatcher is shutting down");
  }

  private void park(DeliveryTask task, String reason) {
    try {
      registry.rememberUndelivered(task.subscriptionId(), task.event().id());
    } catch (SubscriptionNotFoundException e) {
      logger.log(Level.FINE, "Not parking {0}: subscription deleted", task.key());
      return;
    } catch (HooklineException e) {
      logger.log(Level.SEVERE, "Failed to park delivery " + task.key(), e);
      return;
    }
    logger.log(Level.INFO, "Parked delivery {0}: {1}", new Object[]{task.key(), reason});
    notifyObservers(task, DeliveryState.PARKED, reason);
  }

  private void record(String subscriptionId, DeliveryOutcome outcome) {
    try {
      registry.recordDeliveryOutcome(subscriptionId, outcome);
    } catch (SubscriptionNotFoundException e) {
      logger.log(Level.FINE, "Outcome for deleted subscription {0} discarded", subscriptionId);
    } catch (HooklineException e) {
      logger.log(Level.SEVERE, "Failed to record delivery outcome for " + subscriptionId, e);
    }
  }

  private Optional<EventEnvelope> loadEvent(String eventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return eventStore.find(conn, eventId);
    } catch (SQLException e) {
      throw new StoreException("Failed to load event " + eventId, e);
    }
  }

  private void notifyObservers(DeliveryTask task, DeliveryState state, String detail) {
    for (DeliveryObserver observer : observers) {
      try {
        observer.onTransition(task, state, detail);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Delivery observer failed", e);
      }
    }
  }

  private static long elapsedMs(long startNanos) {
    return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
  }

  /**
   * Stops intake, cancels scheduled retries and drains queued tasks within the drain
   * timeout. Tasks still queued when the timeout expires are parked on their
   * subscriptions.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    List<Runnable> pendingRetries = retryScheduler.shutdownNow();
    if (!pendingRetries.isEmpty()) {
      logger.log(Level.INFO, "Cancelled {0} scheduled retries", pendingRetries.size());
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: {0}", queue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    List<DeliveryTask> leftover = new ArrayList<>();
    queue.drainTo(leftover);
    for (DeliveryTask task : leftover) {
      inFlightTracker.release(task.key());
      park(task, "Dispatcher closed before delivery");
    }
  }

  /** Builder for {@link DeliveryDispatcher}. */
  public static final class Builder {
    private SubscriptionRegistry registry;
    private ConnectionProvider connectionProvider;
    private EventStore eventStore;
    private WebhookTransport transport;
    private WebhookSigner signer;
    private InFlightTracker inFlightTracker;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private int workerCount = 4;
    private int queueCapacity = 1000;
    private long enqueueTimeoutMs = 100;
    private long drainTimeoutMs = 5000;
    private String userAgent;
    private MetricsExporter metrics;
    private Clock clock;
    private final List<DeliveryObserver> observers = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the registry that supplies subscriptions and receives delivery outcomes.
     *
     * <p><b>Required.</b>
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the connection provider used to load events for manual retries.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Optional. Defaults to a {@link WebhookSigner} on the system clock. */
    public Builder signer(WebhookSigner signer) {
      this.signer = signer;
      return this;
    }

    /** Optional. Defaults to {@link DefaultInFlightTracker} without expiry. */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 s base delay
     * and a 5 min cap.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the total number of attempts per task, the first one included.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &gt;= 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the number of delivery worker threads.
     *
     * <p>Optional. Defaults to {@code 4}. {@code 0} starts no workers (testing only).
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. Must be &gt; 0. */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets how long {@link #enqueue} waits for queue space before parking the task.
     *
     * <p>Optional. Defaults to {@code 100} ms.
     */
    public Builder enqueueTimeoutMs(long enqueueTimeoutMs) {
      this.enqueueTimeoutMs = enqueueTimeoutMs;
      return this;
    }

    /** Optional. Defaults to {@code 5000} ms. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /** Optional. Defaults to {@value WebhookHeaders#DEFAULT_USER_AGENT}. */
    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder observer(DeliveryObserver observer) {
      this.observers.add(Objects.requireNonNull(observer, "observer"));
      return this;
    }

    /**
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if a limit is out of range
     */
    public DeliveryDispatcher build() {
      return new DeliveryDispatcher(this);
    }
  }
}
