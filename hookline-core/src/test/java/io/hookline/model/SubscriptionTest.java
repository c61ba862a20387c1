package io.hookline.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubscriptionTest {

    private static Subscription.Builder base() {
        return Subscription.builder()
                .id("wh_1")
                .url("https://example.com/hook")
                .events(List.of("order.created"))
                .signingSecret("whsec_secret")
                .verificationToken("token-value")
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void wildcardMatchesEveryType() {
        Subscription sub = base().events(List.of("*")).build();
        assertTrue(sub.listensTo("order.created"));
        assertTrue(sub.listensTo("anything"));
    }

    @Test
    void literalMatchesOnlyItsType() {
        Subscription sub = base().build();
        assertTrue(sub.listensTo("order.created"));
        assertFalse(sub.listensTo("order.updated"));
    }

    @Test
    void duplicateEventsCollapseInOrder() {
        Subscription sub = base().events(List.of("b", "a", "b")).build();
        assertEquals(List.of("b", "a"), sub.events());
    }

    @Test
    void toStringHidesSecrets() {
        String text = base().build().toString();
        assertFalse(text.contains("whsec_secret"));
        assertFalse(text.contains("token-value"));
    }

    @Test
    void toBuilderCopiesEveryField() {
        Subscription original = base().metadata(Map.of("team", "ops")).deliveryCount(3).version(7).build();
        Subscription copy = original.toBuilder().build();
        assertEquals(original, copy);
        assertEquals(3, copy.deliveryCount());
        assertEquals("ops", copy.metadata().get("team"));
        assertEquals(original.createdAt(), copy.updatedAt());
    }

    @Test
    void requiredFieldsAreEnforced() {
        assertThrows(NullPointerException.class, () -> base().url(null).build());
        assertThrows(NullPointerException.class, () -> base().signingSecret(null).build());
    }
}
