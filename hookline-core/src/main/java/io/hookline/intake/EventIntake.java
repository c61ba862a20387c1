package io.hookline.intake;

import io.hookline.EventNotFoundException;
import io.hookline.StoreException;
import io.hookline.ValidationException;
import io.hookline.dispatch.DeliveryDispatcher;
import io.hookline.model.EventEnvelope;
import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionFilter;
import io.hookline.registry.SubscriptionRegistry;
import io.hookline.spi.ConnectionProvider;
import io.hookline.spi.EventStore;
import io.hookline.spi.MetricsExporter;
import io.hookline.util.Ids;
import io.hookline.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accepts application events, stores them and fans them out.
 *
 * <p>{@link #trigger} returns as soon as one delivery task per matching active
 * subscription has been handed to the {@link DeliveryDispatcher}; delivery itself is
 * asynchronous. Two identical triggers produce two events and two fan-outs.
 */
public final class EventIntake {
  private static final Logger logger = Logger.getLogger(EventIntake.class.getName());

  static final int MAX_TYPE_LENGTH = 255;

  private final ConnectionProvider connectionProvider;
  private final EventStore eventStore;
  private final SubscriptionRegistry registry;
  private final DeliveryDispatcher dispatcher;
  private final JsonCodec jsonCodec;
  private final MetricsExporter metrics;
  private final Clock clock;

  private EventIntake(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Stores a new event and queues one delivery per matching active subscription.
   *
   * @param type    event type, non-blank, at most 255 characters
   * @param payload JSON payload; {@code null} or blank becomes {@code {}}
   * @return the stored event with matched and queued counts
   * @throws ValidationException if the type or payload is invalid
   * @throws StoreException      if the event cannot be stored
   */
  public TriggerReceipt trigger(String type, String payload) {
    if (type == null || type.isBlank()) {
      throw new ValidationException("event type is required");
    }
    if (type.length() > MAX_TYPE_LENGTH) {
      throw new ValidationException("event type must be at most " + MAX_TYPE_LENGTH + " characters");
    }
    String payloadJson;
    try {
      payloadJson = jsonCodec.normalize(payload);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("payload must be valid JSON");
    }

    EventEnvelope event = new EventEnvelope(Ids.eventId(), type, payloadJson,
        clock.instant().truncatedTo(ChronoUnit.MILLIS));
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      eventStore.insert(conn, event);
    } catch (SQLException e) {
      throw new StoreException("Failed to store event " + event.id(), e);
    }
    metrics.incrementEventsTriggered();

    List<Subscription> targets = registry.list(SubscriptionFilter.activeFor(type));
    int queued = 0;
    for (Subscription target : targets) {
      if (dispatcher.enqueue(event, target.id())) {
        queued++;
      }
    }
    logger.log(Level.FINE, "Event {0} ({1}) matched {2} subscriptions, queued {3}",
        new Object[]{event.id(), type, targets.size(), queued});
    return new TriggerReceipt(event, targets.size(), queued);
  }

  /**
   * @throws EventNotFoundException if the event was never stored or has been purged
   */
  public EventEnvelope get(String eventId) {
    return find(eventId).orElseThrow(() -> new EventNotFoundException(eventId));
  }

  public Optional<EventEnvelope> find(String eventId) {
    if (eventId == null) {
      return Optional.empty();
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return eventStore.find(conn, eventId);
    } catch (SQLException e) {
      throw new StoreException("Failed to load event " + eventId, e);
    }
  }

  /** Builder for {@link EventIntake}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private EventStore eventStore;
    private SubscriptionRegistry registry;
    private DeliveryDispatcher dispatcher;
    private JsonCodec jsonCodec;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /** <p><b>Required.</b> */
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
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder dispatcher(DeliveryDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /** Optional. Defaults to {@link JsonCodec#getDefault()}. */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
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

    public EventIntake build() {
      return new EventIntake(this);
    }
  }
}
