package io.hookline.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one delivery attempt, reported to the registry.
 *
 * @param status    success or failure
 * @param eventId   the delivered event
 * @param at        when the attempt finished
 * @param error     failure detail, {@code null} on success
 * @param exhausted {@code true} when this was the final attempt of its task
 */
public record DeliveryOutcome(
    DeliveryStatus status,
    String eventId,
    Instant at,
    String error,
    boolean exhausted
) {

  public DeliveryOutcome {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(at, "at");
  }

  public static DeliveryOutcome success(String eventId, Instant at) {
    return new DeliveryOutcome(DeliveryStatus.SUCCESS, eventId, at, null, false);
  }

  public static DeliveryOutcome failure(String eventId, Instant at, String error, boolean exhausted) {
    return new DeliveryOutcome(DeliveryStatus.FAILURE, eventId, at, error, exhausted);
  }

  public boolean isSuccess() {
    return status == DeliveryStatus.SUCCESS;
  }
}
