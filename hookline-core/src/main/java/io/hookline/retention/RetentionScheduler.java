package io.hookline.retention;

import io.hookline.registry.SubscriptionRegistry;
import io.hookline.spi.ConnectionProvider;
import io.hookline.spi.EventPurger;
import io.hookline.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled housekeeping: purges stored events older than the event retention and
 * disables subscriptions that never completed verification.
 *
 * <p>Each purge cycle deletes in batches (default 500) until fewer than
 * {@code batchSize} rows are deleted. Each batch uses its own auto-committed connection
 * to limit lock duration.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see EventPurger
 */
public final class RetentionScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetentionScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final EventPurger purger;
  private final SubscriptionRegistry registry;
  private final Duration eventRetention;
  private final Duration pendingVerificationTimeout;
  private final int batchSize;
  private final long intervalSeconds;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private RetentionScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    this.registry = builder.registry;

    if (builder.eventRetention.isNegative()) {
      throw new IllegalArgumentException("eventRetention must be >= 0");
    }
    if (builder.pendingVerificationTimeout.isNegative()) {
      throw new IllegalArgumentException("pendingVerificationTimeout must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.eventRetention = builder.eventRetention;
    this.pendingVerificationTimeout = builder.pendingVerificationTimeout;
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetentionScheduler has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("hookline-retention-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes one housekeeping cycle. May be invoked directly for tests or one-off runs.
   *
   * @return number of events purged
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    long totalDeleted = 0;
    Instant now = clock.instant();
    try {
      Instant cutoff = now.minus(eventRetention);
      int deleted;
      do {
        deleted = purgeBatch(cutoff);
        totalDeleted += deleted;
      } while (deleted >= batchSize);
      if (totalDeleted > 0) {
        logger.log(Level.INFO, "Purged {0} events older than {1}", new Object[]{totalDeleted, cutoff});
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Event purge failed", e);
    }
    if (registry != null) {
      try {
        int disabled = registry.disableStalePending(now.minus(pendingVerificationTimeout));
        if (disabled > 0) {
          logger.log(Level.INFO, "Disabled {0} subscriptions that never completed verification", disabled);
        }
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Disabling stale pending subscriptions failed", e);
      }
    }
    return totalDeleted;
  }

  private int purgeBatch(Instant cutoff) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return purger.purge(conn, cutoff, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return 0;
    }
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RetentionScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private EventPurger purger;
    private SubscriptionRegistry registry;
    private Duration eventRetention = Duration.ofDays(90);
    private Duration pendingVerificationTimeout = Duration.ofDays(30);
    private int batchSize = 500;
    private long intervalSeconds = 86_400;
    private Clock clock;

    private Builder() {}

    /** <p><b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder purger(EventPurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Sets the registry used to disable stale pending subscriptions.
     *
     * <p>Optional. Without it only events are purged.
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
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

    /** Optional. Defaults to {@code 500}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to {@code 86400} (daily). */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public RetentionScheduler build() {
      return new RetentionScheduler(this);
    }
  }
}
