package io.hookline.registry;

import io.hookline.StoreException;
import io.hookline.SubscriptionNotFoundException;
import io.hookline.ValidationException;
import io.hookline.model.DeliveryOutcome;
import io.hookline.model.DeliveryStatus;
import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionFilter;
import io.hookline.model.SubscriptionPatch;
import io.hookline.model.SubscriptionStatus;
import io.hookline.model.VerificationMode;
import io.hookline.sign.SecretGenerator;
import io.hookline.spi.ConnectionProvider;
import io.hookline.spi.SubscriptionStore;
import io.hookline.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single owner of subscription records and their delivery statistics.
 *
 * <p>Every mutation of one subscription runs under a per-subscription lock and is written
 * with an optimistic version check. A version conflict (another node wrote the row in
 * between) re-reads the row and re-applies the change, up to {@value #MAX_WRITE_ATTEMPTS}
 * times. Mutations on different subscriptions never contend.
 *
 * <p>The delivery dispatcher and the handshake coordinator change subscriptions only
 * through the operations of this class.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see SubscriptionListener
 */
public final class SubscriptionRegistry {
  private static final Logger logger = Logger.getLogger(SubscriptionRegistry.class.getName());

  static final int MAX_WRITE_ATTEMPTS = 5;
  static final int MAX_EVENT_TYPE_LENGTH = 255;

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore store;
  private final SecretGenerator secrets;
  private final TargetUrlValidator urlValidator;
  private final int failureCeiling;
  private final Clock clock;
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final List<SubscriptionListener> listeners = new CopyOnWriteArrayList<>();

  private SubscriptionRegistry(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    if (builder.failureCeiling < 1) {
      throw new IllegalArgumentException("failureCeiling must be >= 1");
    }
    this.failureCeiling = builder.failureCeiling;
    this.secrets = builder.secrets != null ? builder.secrets : new SecretGenerator();
    this.urlValidator = builder.urlValidator != null
        ? builder.urlValidator : new TargetUrlValidator(false);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public void addListener(SubscriptionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(SubscriptionListener listener) {
    listeners.remove(listener);
  }

  public int failureCeiling() {
    return failureCeiling;
  }

  /**
   * Registers a new subscription. Modes other than {@link VerificationMode#NONE} start in
   * {@code pending-verification}; listeners are notified so the handshake can start.
   *
   * @param url              absolute http(s) target
   * @param events           non-empty list of event types, {@code *} for all
   * @param verificationMode handshake mode; {@code null} selects stripe-style
   * @param metadata         opaque caller data, may be {@code null}
   * @return the stored subscription, including its signing secret
   * @throws ValidationException if any input is invalid
   */
  public Subscription create(String url, List<String> events, VerificationMode verificationMode,
      Map<String, Object> metadata) {
    String target = urlValidator.validate(url);
    List<String> eventTypes = validateEvents(events);
    VerificationMode mode = verificationMode != null ? verificationMode : VerificationMode.STRIPE_STYLE;
    Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

    Subscription subscription = Subscription.builder()
        .id(Ids.subscriptionId())
        .url(target)
        .events(eventTypes)
        .verificationMode(mode)
        .signingSecret(secrets.signingSecret())
        .verificationToken(secrets.verificationToken())
        .status(mode.requiresHandshake() ? SubscriptionStatus.PENDING_VERIFICATION : SubscriptionStatus.ACTIVE)
        .metadata(metadata)
        .createdAt(now)
        .updatedAt(now)
        .version(0)
        .build();

    withConnection("create subscription", conn -> {
      store.insert(conn, subscription);
      return null;
    });
    logger.log(Level.INFO, "Created subscription {0} for {1} (mode={2}, status={3})",
        new Object[]{subscription.id(), target, mode.code(), subscription.status().code()});

    notifyListeners(l -> l.afterCreate(subscription));
    return subscription;
  }

  /**
   * @throws SubscriptionNotFoundException if no subscription has this id
   */
  public Subscription get(String id) {
    return find(id).orElseThrow(() -> new SubscriptionNotFoundException(id));
  }

  public Optional<Subscription> find(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return withConnection("find subscription", conn -> store.find(conn, id));
  }

  /**
   * Lists subscriptions matching {@code filter}, ordered by creation time then id.
   */
  public List<Subscription> list(SubscriptionFilter filter) {
    SubscriptionFilter effective = filter != null ? filter : SubscriptionFilter.ALL;
    List<Subscription> all = withConnection("list subscriptions",
        conn -> store.findAll(conn, effective.status()));
    List<Subscription> matched = new ArrayList<>();
    for (Subscription subscription : all) {
      if (effective.matches(subscription)) {
        matched.add(subscription);
      }
    }
    matched.sort(Comparator.comparing(Subscription::createdAt).thenComparing(Subscription::id));
    return matched;
  }

  /**
   * Applies a partial update.
   *
   * <ul>
   *   <li>A URL change on a pending subscription re-arms the handshake with a new token.
   *       On an active subscription it takes effect without re-verification.</li>
   *   <li>Switching the mode to {@code none} while pending activates the subscription;
   *       switching between handshake modes while pending re-arms the handshake.</li>
   *   <li>{@code status} may be set to {@code active} (from {@code disabled} or
   *       {@code failed}, clearing consecutive failures) or to {@code disabled}. A
   *       subscription whose mode needs a handshake and that was never verified goes
   *       back to {@code pending-verification} with a new token instead.</li>
   *   <li>{@code metadata} entries are merged into the existing metadata.</li>
   * </ul>
   *
   * @throws SubscriptionNotFoundException if no subscription has this id
   * @throws ValidationException           if the patch is invalid for the current state
   */
  public Subscription update(String id, SubscriptionPatch patch) {
    Objects.requireNonNull(patch, "patch");
    String url = patch.url() != null ? urlValidator.validate(patch.url()) : null;
    List<String> events = patch.events() != null ? validateEvents(patch.events()) : null;
    SubscriptionStatus requestedStatus = patch.status();
    if (requestedStatus == SubscriptionStatus.FAILED
        || requestedStatus == SubscriptionStatus.PENDING_VERIFICATION) {
      throw new ValidationException("status can only be set to active or disabled");
    }

    Subscription[] before = new Subscription[1];
    Subscription after = mutate(id, current -> {
      before[0] = current;
      return applyPatch(current, url, events, requestedStatus, patch);
    });
    if (after != before[0]) {
      notifyListeners(l -> l.afterUpdate(before[0], after));
    }
    return after;
  }

  private Subscription applyPatch(Subscription current, String url, List<String> events,
      SubscriptionStatus requestedStatus, SubscriptionPatch patch) {
    Subscription.Builder next = current.toBuilder();
    SubscriptionStatus status = current.status();
    VerificationMode mode = current.verificationMode();
    boolean rearm = false;

    if (url != null && !url.equals(current.url())) {
      next.url(url);
      rearm = status == SubscriptionStatus.PENDING_VERIFICATION;
    }
    if (events != null) {
      next.events(events);
    }
    if (patch.verificationMode() != null && patch.verificationMode() != mode) {
      mode = patch.verificationMode();
      next.verificationMode(mode);
      if (status == SubscriptionStatus.PENDING_VERIFICATION) {
        if (mode.requiresHandshake()) {
          rearm = true;
        } else {
          status = SubscriptionStatus.ACTIVE;
          rearm = false;
          next.lastHandshakeError(null);
        }
      }
    }
    if (requestedStatus == SubscriptionStatus.ACTIVE) {
      if (status == SubscriptionStatus.PENDING_VERIFICATION) {
        throw new ValidationException(
            "Subscription " + current.id() + " must complete verification before it can be activated");
      }
      if (status != SubscriptionStatus.ACTIVE) {
        next.consecutiveFailures(0);
        if (mode.requiresHandshake() && current.verifiedAt() == null) {
          // never verified: back to pending with a fresh handshake
          status = SubscriptionStatus.PENDING_VERIFICATION;
          rearm = true;
        } else {
          status = SubscriptionStatus.ACTIVE;
        }
      }
    } else if (requestedStatus == SubscriptionStatus.DISABLED) {
      status = SubscriptionStatus.DISABLED;
      rearm = false;
    }
    if (patch.metadata() != null) {
      Map<String, Object> merged = new LinkedHashMap<>(current.metadata());
      merged.putAll(patch.metadata());
      next.metadata(merged);
    }
    if (rearm) {
      next.verificationToken(secrets.verificationToken()).lastHandshakeError(null);
    }
    return next.status(status).build();
  }

  /**
   * @throws SubscriptionNotFoundException if no subscription has this id
   */
  public void delete(String id) {
    ReentrantLock lock = lockFor(id);
    lock.lock();
    try {
      int deleted = withConnection("delete subscription", conn -> store.delete(conn, id));
      if (deleted == 0) {
        throw new SubscriptionNotFoundException(id);
      }
      logger.log(Level.INFO, "Deleted subscription {0}", id);
    } finally {
      locks.remove(id);
      lock.unlock();
    }
  }

  /**
   * Folds one delivery attempt into the subscription's statistics. When consecutive
   * failures reach the ceiling an active subscription becomes {@code failed}.
   *
   * @throws SubscriptionNotFoundException if the subscription was deleted meanwhile
   */
  public Subscription recordDeliveryOutcome(String id, DeliveryOutcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    Subscription updated = mutate(id, current -> {
      Subscription.Builder next = current.toBuilder().lastDeliveryAt(outcome.at());
      if (outcome.isSuccess()) {
        next.deliveryCount(current.deliveryCount() + 1)
            .consecutiveFailures(0)
            .lastDeliveryStatus(DeliveryStatus.SUCCESS)
            .lastDeliveryError(null);
        if (outcome.eventId() != null && outcome.eventId().equals(current.lastFailedEventId())) {
          next.lastFailedEventId(null);
        }
        return next.build();
      }
      int failures = current.consecutiveFailures() + 1;
      next.consecutiveFailures(failures)
          .lastDeliveryStatus(DeliveryStatus.FAILURE)
          .lastDeliveryError(outcome.error());
      if (outcome.exhausted() && outcome.eventId() != null) {
        next.lastFailedEventId(outcome.eventId());
      }
      if (current.isActive() && failures >= failureCeiling) {
        next.status(SubscriptionStatus.FAILED);
      }
      return next.build();
    });
    if (updated.status() == SubscriptionStatus.FAILED
        && updated.consecutiveFailures() == failureCeiling) {
      logger.log(Level.WARNING, "Subscription {0} marked failed after {1} consecutive failures",
          new Object[]{id, failureCeiling});
    }
    return updated;
  }

  /**
   * Resets a subscription for another round of deliveries: {@code failed} becomes
   * {@code active} and consecutive failures are cleared. Other statuses are kept;
   * a {@code disabled} subscription is re-enabled through {@link #update}.
   *
   * @throws SubscriptionNotFoundException if no subscription has this id
   */
  public Subscription retry(String id) {
    Subscription retried = mutate(id, current -> {
      Subscription.Builder next = current.toBuilder().consecutiveFailures(0);
      if (current.status() == SubscriptionStatus.FAILED) {
        next.status(SubscriptionStatus.ACTIVE);
      }
      return next.build();
    });
    logger.log(Level.INFO, "Subscription {0} reset for retry (status={1})",
        new Object[]{id, retried.status().code()});
    notifyListeners(l -> l.afterRetry(retried));
    return retried;
  }

  /**
   * Activates a pending subscription after a successful handshake against {@code url}.
   * Stale results (subscription no longer pending, or URL changed since the handshake
   * started) are ignored.
   *
   * @return the current subscription state
   */
  public Subscription markVerified(String id, String url) {
    return mutate(id, current -> {
      if (!isAwaitingHandshakeFor(current, url)) {
        logger.log(Level.FINE, "Ignoring stale verification of {0} against {1}", new Object[]{id, url});
        return current;
      }
      return current.toBuilder()
          .status(SubscriptionStatus.ACTIVE)
          .verifiedAt(clock.instant())
          .lastHandshakeError(null)
          .consecutiveFailures(0)
          .build();
    });
  }

  /**
   * Records a failed handshake against {@code url}. The subscription stays pending.
   * Stale results are ignored.
   *
   * @return the current subscription state
   */
  public Subscription recordHandshakeFailure(String id, String url, String error) {
    return mutate(id, current -> {
      if (!isAwaitingHandshakeFor(current, url)) {
        return current;
      }
      return current.toBuilder().lastHandshakeError(error).build();
    });
  }

  /**
   * Remembers an event that could not be delivered so {@link #retry} can re-enqueue it.
   */
  public Subscription rememberUndelivered(String id, String eventId) {
    return mutate(id, current -> eventId.equals(current.lastFailedEventId())
        ? current
        : current.toBuilder().lastFailedEventId(eventId).build());
  }

  /**
   * Disables subscriptions created before {@code cutoff} that are still waiting for
   * verification.
   *
   * @return number of subscriptions disabled
   */
  public int disableStalePending(Instant cutoff) {
    List<Subscription> stale = withConnection("find stale pending subscriptions",
        conn -> store.findCreatedBefore(conn, SubscriptionStatus.PENDING_VERIFICATION, cutoff));
    int disabled = 0;
    for (Subscription candidate : stale) {
      try {
        Subscription result = mutate(candidate.id(), current ->
            current.status() == SubscriptionStatus.PENDING_VERIFICATION
                ? current.toBuilder()
                    .status(SubscriptionStatus.DISABLED)
                    .lastHandshakeError("Verification not completed within retention window")
                    .build()
                : current);
        if (result.status() == SubscriptionStatus.DISABLED) {
          disabled++;
        }
      } catch (SubscriptionNotFoundException e) {
        logger.log(Level.FINE, "Stale subscription {0} deleted before it could be disabled", candidate.id());
      }
    }
    return disabled;
  }

  private static boolean isAwaitingHandshakeFor(Subscription current, String url) {
    return current.status() == SubscriptionStatus.PENDING_VERIFICATION
        && current.verificationMode().requiresHandshake()
        && current.url().equals(url);
  }

  private Subscription mutate(String id, UnaryOperator<Subscription> change) {
    ReentrantLock lock = lockFor(id);
    lock.lock();
    try {
      for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
        Optional<Subscription> written = withConnection("update subscription", conn -> {
          Subscription current = store.find(conn, id)
              .orElseThrow(() -> new SubscriptionNotFoundException(id));
          Subscription next = change.apply(current);
          if (next == current) {
            return Optional.of(current);
          }
          Subscription versioned = next.toBuilder()
              .version(current.version() + 1)
              .updatedAt(clock.instant())
              .build();
          if (store.update(conn, versioned, current.version()) == 1) {
            return Optional.of(versioned);
          }
          return Optional.empty();
        });
        if (written.isPresent()) {
          return written.get();
        }
        logger.log(Level.FINE, "Version conflict on subscription {0}, attempt {1}",
            new Object[]{id, attempt});
      }
      throw new StoreException("Subscription " + id + " kept changing concurrently; gave up after "
          + MAX_WRITE_ATTEMPTS + " attempts");
    } finally {
      lock.unlock();
    }
  }

  private ReentrantLock lockFor(String id) {
    if (id == null) {
      throw new SubscriptionNotFoundException("null");
    }
    return locks.computeIfAbsent(id, k -> new ReentrantLock());
  }

  private static List<String> validateEvents(List<String> events) {
    if (events == null || events.isEmpty()) {
      throw new ValidationException("events must be a non-empty array");
    }
    Set<String> unique = new LinkedHashSet<>();
    for (String event : events) {
      if (event == null || event.isBlank()) {
        throw new ValidationException("events must not contain blank entries");
      }
      String trimmed = event.trim();
      if (trimmed.length() > MAX_EVENT_TYPE_LENGTH) {
        throw new ValidationException("event type must be at most " + MAX_EVENT_TYPE_LENGTH + " characters");
      }
      unique.add(trimmed);
    }
    return List.copyOf(unique);
  }

  private void notifyListeners(ListenerCall call) {
    for (SubscriptionListener listener : listeners) {
      try {
        call.invoke(listener);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Subscription listener " + listener.getClass().getName() + " failed", e);
      }
    }
  }

  private <T> T withConnection(String action, SqlFunction<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException e) {
      throw new StoreException("Failed to " + action, e);
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  @FunctionalInterface
  private interface ListenerCall {
    void invoke(SubscriptionListener listener);
  }

  /** Builder for {@link SubscriptionRegistry}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore store;
    private SecretGenerator secrets;
    private TargetUrlValidator urlValidator;
    private int failureCeiling = 10;
    private Clock clock;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder store(SubscriptionStore store) {
      this.store = store;
      return this;
    }

    /** Optional. Defaults to a {@link SecretGenerator} over {@code SecureRandom}. */
    public Builder secrets(SecretGenerator secrets) {
      this.secrets = secrets;
      return this;
    }

    /** Optional. Defaults to a validator that blocks private and loopback hosts. */
    public Builder urlValidator(TargetUrlValidator urlValidator) {
      this.urlValidator = urlValidator;
      return this;
    }

    /**
     * Sets the number of consecutive failed attempts after which an active subscription
     * becomes {@code failed}.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt;= 1.
     */
    public Builder failureCeiling(int failureCeiling) {
      this.failureCeiling = failureCeiling;
      return this;
    }

    /** Optional. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public SubscriptionRegistry build() {
      return new SubscriptionRegistry(this);
    }
  }
}
