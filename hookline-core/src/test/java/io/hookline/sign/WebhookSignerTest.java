package io.hookline.sign;

import io.hookline.ConfigurationException;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookSignerTest {
    private static final long NOW = 1_700_000_000L;
    private static final String SECRET = "whsec_test";
    private static final String BODY = "{\"id\":\"evt_1\",\"type\":\"order.created\",\"data\":{},\"created\":1700000000}";

    private final WebhookSigner signer = new WebhookSigner(
            Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC), 300);

    @Test
    void signsTimestampDotBodyWithHmacSha256() throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        String expected = "v1=" + HexFormat.of().formatHex(
                mac.doFinal((NOW + "." + BODY).getBytes(StandardCharsets.UTF_8)));

        assertEquals(expected, signer.sign(SECRET, NOW, BODY));
    }

    @Test
    void signIsDeterministic() {
        assertEquals(signer.sign(SECRET, NOW, BODY), signer.sign(SECRET, NOW, BODY));
    }

    @Test
    void signatureHasSchemePrefixAndHexDigest() {
        String signature = signer.sign(SECRET, NOW, BODY);
        assertTrue(signature.matches("v1=[0-9a-f]{64}"), signature);
    }

    @Test
    void verifyAcceptsFreshSignature() {
        String signature = signer.sign(SECRET, NOW - 10, BODY);
        assertTrue(signer.verify(SECRET, NOW - 10, BODY, signature));
    }

    @Test
    void verifyAcceptsTimestampAtToleranceEdge() {
        String signature = signer.sign(SECRET, NOW - 300, BODY);
        assertTrue(signer.verify(SECRET, NOW - 300, BODY, signature));
    }

    @Test
    void verifyRejectsStaleTimestamp() {
        String signature = signer.sign(SECRET, NOW - 301, BODY);
        assertFalse(signer.verify(SECRET, NOW - 301, BODY, signature));
    }

    @Test
    void verifyRejectsTimestampFromTheFuture() {
        String signature = signer.sign(SECRET, NOW + 600, BODY);
        assertFalse(signer.verify(SECRET, NOW + 600, BODY, signature));
    }

    @Test
    void verifyRejectsTimestampsThatOverflowTheWindow() {
        long wrapped = Long.MIN_VALUE + NOW;
        assertFalse(signer.verify(SECRET, wrapped, BODY, signer.sign(SECRET, wrapped, BODY)));
        assertFalse(signer.verify(SECRET, Long.MIN_VALUE, BODY, signer.sign(SECRET, Long.MIN_VALUE, BODY),
                Long.MAX_VALUE));
        assertFalse(signer.verify(SECRET, Long.MAX_VALUE, BODY, signer.sign(SECRET, Long.MAX_VALUE, BODY)));
    }

    @Test
    void verifyHonoursExplicitTolerance() {
        String signature = signer.sign(SECRET, NOW - 1000, BODY);
        assertTrue(signer.verify(SECRET, NOW - 1000, BODY, signature, 3600));
    }

    @Test
    void verifyRejectsTamperedBody() {
        String signature = signer.sign(SECRET, NOW, BODY);
        assertFalse(signer.verify(SECRET, NOW, BODY.replace("order", "0rder"), signature));
    }

    @Test
    void verifyRejectsWrongSecret() {
        String signature = signer.sign(SECRET, NOW, BODY);
        assertFalse(signer.verify("whsec_other", NOW, BODY, signature));
    }

    @Test
    void verifyRejectsNullAndMalformedCandidates() {
        String digest = signer.sign(SECRET, NOW, BODY).substring(3);
        assertFalse(signer.verify(SECRET, NOW, BODY, null));
        assertFalse(signer.verify(SECRET, NOW, BODY, ""));
        assertFalse(signer.verify(SECRET, NOW, BODY, digest));
        assertFalse(signer.verify(SECRET, NOW, BODY, "v0=" + digest));
        assertFalse(signer.verify(SECRET, NOW, BODY, "v1=" + digest.toUpperCase()));
    }

    @Test
    void missingAlgorithmIsAConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> new WebhookSigner(Clock.systemUTC(), 300, "HmacNoSuchThing"));
    }

    @Test
    void negativeToleranceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WebhookSigner(Clock.systemUTC(), -1));
    }
}
