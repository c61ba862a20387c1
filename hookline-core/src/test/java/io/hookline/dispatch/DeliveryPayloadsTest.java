package io.hookline.dispatch;

import io.hookline.model.EventEnvelope;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DeliveryPayloadsTest {

    @Test
    void embedsPayloadAsDataObject() {
        EventEnvelope event = new EventEnvelope("evt_1", "order.created", "{\"orderId\":\"o1\"}",
                Instant.parse("2024-01-01T00:00:00.750Z"));

        assertEquals("{\"id\":\"evt_1\",\"type\":\"order.created\",\"data\":{\"orderId\":\"o1\"},\"created\":1704067200}",
                DeliveryPayloads.toWireJson(event));
    }

    @Test
    void escapesTypeButNotData() {
        EventEnvelope event = new EventEnvelope("evt_2", "say \"hi\"", "[1,2]",
                Instant.ofEpochSecond(10));

        assertEquals("{\"id\":\"evt_2\",\"type\":\"say \\\"hi\\\"\",\"data\":[1,2],\"created\":10}",
                DeliveryPayloads.toWireJson(event));
    }
}
