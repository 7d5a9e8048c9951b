package io.kudos.delivery;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class WebhookSignaturesTest {

    @Test
    void knownHmacSha256Vector() {
        // RFC 4231 test case 2
        assertEquals("sha256=5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843",
                WebhookSignatures.sign("what do ya want for nothing?", "Jefe"));
    }

    @Test
    void differentSecretsDiffer() {
        assertNotEquals(WebhookSignatures.sign("{}", "a"), WebhookSignatures.sign("{}", "b"));
    }
}
