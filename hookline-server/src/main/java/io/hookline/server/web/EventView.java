package io.hookline.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import io.hookline.intake.TriggerReceipt;
import io.hookline.model.EventEnvelope;

/**
 * Stored event as returned by the events API. {@code data} is the normalized payload,
 * written through unchanged. The counts are only present in trigger responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventView(
    String id,
    String type,
    @JsonRawValue String data,
    long created,
    Integer matchedSubscriptions,
    Integer queuedDeliveries
) {

  static EventView of(EventEnvelope event) {
    return new EventView(event.id(), event.type(), event.payloadJson(), event.created(), null, null);
  }

  static EventView of(TriggerReceipt receipt) {
    EventEnvelope event = receipt.event();
    return new EventView(event.id(), event.type(), event.payloadJson(), event.created(),
        receipt.matchedSubscriptions(), receipt.queuedDeliveries());
  }
}
