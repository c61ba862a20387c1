package io.hookline.intake;

import io.hookline.EventNotFoundException;
import io.hookline.ValidationException;
import io.hookline.dispatch.DeliveryDispatcher;
import io.hookline.dispatch.DeliveryPayloads;
import io.hookline.model.EventEnvelope;
import io.hookline.model.Subscription;
import io.hookline.model.VerificationMode;
import io.hookline.registry.SubscriptionRegistry;
import io.hookline.testing.InMemoryEventStore;
import io.hookline.testing.InMemorySubscriptionStore;
import io.hookline.testing.StubTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static io.hookline.testing.TestConnections.stubCp;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventIntakeTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00.123456Z");

    private final InMemoryEventStore events = new InMemoryEventStore();
    private SubscriptionRegistry registry;
    private DeliveryDispatcher dispatcher;
    private EventIntake intake;

    @BeforeEach
    void setUp() {
        registry = SubscriptionRegistry.builder()
                .connectionProvider(stubCp())
                .store(new InMemorySubscriptionStore())
                .build();
        dispatcher = DeliveryDispatcher.builder()
                .registry(registry)
                .connectionProvider(stubCp())
                .eventStore(events)
                .transport(new StubTransport())
                .workerCount(0)
                .drainTimeoutMs(100)
                .build();
        intake = EventIntake.builder()
                .connectionProvider(stubCp())
                .eventStore(events)
                .registry(registry)
                .dispatcher(dispatcher)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    void payloadNumbersAreStoredAndDeliveredUnchanged() {
        String payload = "{\"amount\":1.10,\"big\":1e400,\"precise\":0.12345678901234567890123}";
        String expected = "{\"amount\":1.10,\"big\":1E+400,\"precise\":0.12345678901234567890123}";

        TriggerReceipt receipt = intake.trigger("invoice.paid", payload);

        assertEquals(expected, receipt.event().payloadJson());
        EventEnvelope stored = intake.find(receipt.event().id()).orElseThrow();
        assertEquals(expected, stored.payloadJson());
        assertTrue(DeliveryPayloads.toWireJson(stored).contains("\"data\":" + expected + ","));
    }

    @Test
    void triggerStoresEventAndFansOutToMatchingActiveSubscriptions() {
        registry.create("https://a.example.com/in", List.of("order.created"), VerificationMode.NONE, null);
        registry.create("https://b.example.com/in", List.of("*"), VerificationMode.NONE, null);
        registry.create("https://c.example.com/in", List.of("user.created"), VerificationMode.NONE, null);
        registry.create("https://d.example.com/in", List.of("order.created"), VerificationMode.STRIPE_STYLE, null);

        TriggerReceipt receipt = intake.trigger("order.created", "{ \"orderId\" : \"o1\" }");

        EventEnvelope event = receipt.event();
        assertTrue(event.id().matches("evt_[0-9a-f]{32}"));
        assertEquals("order.created", event.type());
        assertEquals("{\"orderId\":\"o1\"}", event.payloadJson());
        assertEquals(Instant.parse("2024-03-01T12:00:00.123Z"), event.createdAt());
        assertEquals(2, receipt.matchedSubscriptions());
        assertEquals(2, receipt.queuedDeliveries());
        assertEquals(2, dispatcher.queueDepth());
        assertSame(event, intake.get(event.id()));
    }

    @Test
    void triggerWithoutSubscribersStillStoresEvent() {
        TriggerReceipt receipt = intake.trigger("order.created", null);

        assertEquals("{}", receipt.event().payloadJson());
        assertEquals(0, receipt.matchedSubscriptions());
        assertEquals(1, events.size());
    }

    @Test
    void identicalTriggersProduceDistinctEvents() {
        Subscription sub = registry.create("https://a.example.com/in", List.of("*"), VerificationMode.NONE, null);

        TriggerReceipt first = intake.trigger("order.created", "{}");
        TriggerReceipt second = intake.trigger("order.created", "{}");

        assertNotEquals(first.event().id(), second.event().id());
        assertEquals(1, second.queuedDeliveries());
        assertEquals(2, dispatcher.queueDepth());
        assertEquals(sub.id(), registry.list(null).get(0).id());
    }

    @Test
    void rejectsInvalidTypeOrPayload() {
        assertThrows(ValidationException.class, () -> intake.trigger(null, "{}"));
        assertThrows(ValidationException.class, () -> intake.trigger("  ", "{}"));
        assertThrows(ValidationException.class, () -> intake.trigger("t".repeat(256), "{}"));
        ValidationException e = assertThrows(ValidationException.class,
                () -> intake.trigger("order.created", "{not json"));
        assertEquals("payload must be valid JSON", e.getMessage());
        assertEquals(0, events.size());
    }

    @Test
    void unknownEventIsNotFound() {
        assertThrows(EventNotFoundException.class, () -> intake.get("evt_missing"));
        assertTrue(intake.find(null).isEmpty());
    }
}
