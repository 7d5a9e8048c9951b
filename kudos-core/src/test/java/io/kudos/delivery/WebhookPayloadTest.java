package io.kudos.delivery;

import io.kudos.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WebhookPayloadTest {

    @Test
    void includesOptionalFieldsWhenPresent() {
        WebhookPayload payload = new WebhookPayload("Ada", "msg", "message", "animal", "Grace",
                Instant.parse("2024-01-05T12:00:00Z"));

        assertEquals("{\"recipient\":\"Ada\",\"message\":\"msg\",\"endpoint\":\"message\","
                        + "\"messageType\":\"animal\",\"from\":\"Grace\",\"timestamp\":\"2024-01-05T12:00:00Z\"}",
                payload.toJson(JsonCodec.getDefault()));
    }

    @Test
    void omitsAbsentOptionalFields() {
        WebhookPayload payload = new WebhookPayload("Ada", "msg", "awesome", null, null,
                Instant.parse("2024-01-05T12:00:00Z"));

        assertEquals("{\"recipient\":\"Ada\",\"message\":\"msg\",\"endpoint\":\"awesome\","
                + "\"timestamp\":\"2024-01-05T12:00:00Z\"}", payload.toJson(JsonCodec.getDefault()));
    }

    @Test
    void requiredFieldsEnforced() {
        assertThrows(NullPointerException.class,
                () -> new WebhookPayload(null, "m", "awesome", null, null, Instant.EPOCH));
    }
}
