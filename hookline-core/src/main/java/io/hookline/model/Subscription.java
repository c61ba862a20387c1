package io.hookline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a webhook subscription.
 *
 * <p>Instances are only ever produced by the registry or a store; use {@link #toBuilder()}
 * to derive a modified copy. {@link #toString()} never includes the signing secret or the
 * verification token.
 */
public final class Subscription {

  /** Event-set entry that matches every event type. */
  public static final String WILDCARD = "*";

  private final String id;
  private final String url;
  private final List<String> events;
  private final VerificationMode verificationMode;
  private final String signingSecret;
  private final String verificationToken;
  private final SubscriptionStatus status;
  private final long deliveryCount;
  private final int consecutiveFailures;
  private final Instant lastDeliveryAt;
  private final DeliveryStatus lastDeliveryStatus;
  private final String lastDeliveryError;
  private final String lastFailedEventId;
  private final Instant verifiedAt;
  private final String lastHandshakeError;
  private final Map<String, Object> metadata;
  private final Instant createdAt;
  private final Instant updatedAt;
  private final long version;

  private Subscription(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.url = Objects.requireNonNull(builder.url, "url");
    this.events = List.copyOf(new LinkedHashSet<>(Objects.requireNonNull(builder.events, "events")));
    this.verificationMode = Objects.requireNonNull(builder.verificationMode, "verificationMode");
    this.signingSecret = Objects.requireNonNull(builder.signingSecret, "signingSecret");
    this.verificationToken = builder.verificationToken;
    this.status = Objects.requireNonNull(builder.status, "status");
    this.deliveryCount = builder.deliveryCount;
    this.consecutiveFailures = builder.consecutiveFailures;
    this.lastDeliveryAt = builder.lastDeliveryAt;
    this.lastDeliveryStatus = builder.lastDeliveryStatus;
    this.lastDeliveryError = builder.lastDeliveryError;
    this.lastFailedEventId = builder.lastFailedEventId;
    this.verifiedAt = builder.verifiedAt;
    this.lastHandshakeError = builder.lastHandshakeError;
    this.metadata = builder.metadata == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
    this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
    this.version = builder.version;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public String id() {
    return id;
  }

  public String url() {
    return url;
  }

  public List<String> events() {
    return events;
  }

  public VerificationMode verificationMode() {
    return verificationMode;
  }

  public String signingSecret() {
    return signingSecret;
  }

  public String verificationToken() {
    return verificationToken;
  }

  public SubscriptionStatus status() {
    return status;
  }

  public long deliveryCount() {
    return deliveryCount;
  }

  public int consecutiveFailures() {
    return consecutiveFailures;
  }

  public Instant lastDeliveryAt() {
    return lastDeliveryAt;
  }

  public DeliveryStatus lastDeliveryStatus() {
    return lastDeliveryStatus;
  }

  public String lastDeliveryError() {
    return lastDeliveryError;
  }

  public String lastFailedEventId() {
    return lastFailedEventId;
  }

  public Instant verifiedAt() {
    return verifiedAt;
  }

  public String lastHandshakeError() {
    return lastHandshakeError;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public long version() {
    return version;
  }

  public boolean isActive() {
    return status == SubscriptionStatus.ACTIVE;
  }

  /**
   * Returns {@code true} if this subscription's event set contains {@code eventType}
   * or the wildcard.
   */
  public boolean listensTo(String eventType) {
    return events.contains(WILDCARD) || events.contains(eventType);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Subscription other)) return false;
    return id.equals(other.id) && version == other.version;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, version);
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id
        + ", url=" + url
        + ", events=" + events
        + ", mode=" + verificationMode.code()
        + ", status=" + status.code()
        + ", deliveryCount=" + deliveryCount
        + ", consecutiveFailures=" + consecutiveFailures
        + ", version=" + version
        + '}';
  }

  /** Builder for {@link Subscription}. */
  public static final class Builder {
    private String id;
    private String url;
    private List<String> events;
    private VerificationMode verificationMode = VerificationMode.STRIPE_STYLE;
    private String signingSecret;
    private String verificationToken;
    private SubscriptionStatus status = SubscriptionStatus.PENDING_VERIFICATION;
    private long deliveryCount;
    private int consecutiveFailures;
    private Instant lastDeliveryAt;
    private DeliveryStatus lastDeliveryStatus;
    private String lastDeliveryError;
    private String lastFailedEventId;
    private Instant verifiedAt;
    private String lastHandshakeError;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;
    private long version;

    private Builder() {}

    private Builder(Subscription s) {
      this.id = s.id;
      this.url = s.url;
      this.events = s.events;
      this.verificationMode = s.verificationMode;
      this.signingSecret = s.signingSecret;
      this.verificationToken = s.verificationToken;
      this.status = s.status;
      this.deliveryCount = s.deliveryCount;
      this.consecutiveFailures = s.consecutiveFailures;
      this.lastDeliveryAt = s.lastDeliveryAt;
      this.lastDeliveryStatus = s.lastDeliveryStatus;
      this.lastDeliveryError = s.lastDeliveryError;
      this.lastFailedEventId = s.lastFailedEventId;
      this.verifiedAt = s.verifiedAt;
      this.lastHandshakeError = s.lastHandshakeError;
      this.metadata = s.metadata;
      this.createdAt = s.createdAt;
      this.updatedAt = s.updatedAt;
      this.version = s.version;
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder events(List<String> events) {
      this.events = events;
      return this;
    }

    public Builder verificationMode(VerificationMode verificationMode) {
      this.verificationMode = verificationMode;
      return this;
    }

    public Builder signingSecret(String signingSecret) {
      this.signingSecret = signingSecret;
      return this;
    }

    public Builder verificationToken(String verificationToken) {
      this.verificationToken = verificationToken;
      return this;
    }

    public Builder status(SubscriptionStatus status) {
      this.status = status;
      return this;
    }

    public Builder deliveryCount(long deliveryCount) {
      this.deliveryCount = deliveryCount;
      return this;
    }

    public Builder consecutiveFailures(int consecutiveFailures) {
      this.consecutiveFailures = consecutiveFailures;
      return this;
    }

    public Builder lastDeliveryAt(Instant lastDeliveryAt) {
      this.lastDeliveryAt = lastDeliveryAt;
      return this;
    }

    public Builder lastDeliveryStatus(DeliveryStatus lastDeliveryStatus) {
      this.lastDeliveryStatus = lastDeliveryStatus;
      return this;
    }

    public Builder lastDeliveryError(String lastDeliveryError) {
      this.lastDeliveryError = lastDeliveryError;
      return this;
    }

    public Builder lastFailedEventId(String lastFailedEventId) {
      this.lastFailedEventId = lastFailedEventId;
      return this;
    }

    public Builder verifiedAt(Instant verifiedAt) {
      this.verifiedAt = verifiedAt;
      return this;
    }

    public Builder lastHandshakeError(String lastHandshakeError) {
      this.lastHandshakeError = lastHandshakeError;
      return this;
    }

    public Builder metadata(Map<String, Object> metadata) {
      this.metadata = metadata;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder version(long version) {
      this.version = version;
      return this;
    }

    /**
     * @throws NullPointerException if a required field is missing
     */
    public Subscription build() {
      return new Subscription(this);
    }
  }
}
