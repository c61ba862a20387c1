package io.hookline.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of an application event accepted by intake.
 *
 * <p>{@code payloadJson} is compact JSON and opaque to hookline: it is embedded verbatim as
 * the {@code data} field of every delivery.
 *
 * @param id          unique event id ({@code evt_...})
 * @param type        caller-chosen event type, e.g. {@code order.created}
 * @param payloadJson compact JSON payload
 * @param createdAt   intake instant
 */
public record EventEnvelope(String id, String type, String payloadJson, Instant createdAt) {

  public EventEnvelope {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payloadJson, "payloadJson");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /** Intake time as integer seconds since the epoch, as embedded in the wire payload. */
  public long created() {
    return createdAt.getEpochSecond();
  }
}
