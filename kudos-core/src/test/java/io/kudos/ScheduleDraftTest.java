package io.kudos;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleDraftTest {

    private static ScheduleDraft.Builder minimal() {
        return ScheduleDraft.builder()
                .recipient("Ada")
                .recipientEmail("ada@example.com")
                .endpoint(MessageEndpoint.AWESOME)
                .cron("0 17 * * FRI")
                .nextRun(100L)
                .createdBy("alice");
    }

    @Test
    void defaultsToEmailAndNormalizesEmptyOptionals() {
        ScheduleDraft draft = minimal().messageType("").from("").webhookUrl("").webhookSecret("").build();

        assertEquals(DeliveryMethod.EMAIL, draft.deliveryMethod());
        assertNull(draft.messageType());
        assertNull(draft.from());
        assertNull(draft.webhookUrl());
        assertNull(draft.webhookSecret());
    }

    @Test
    void requiredFieldsAreEnforced() {
        assertThrows(NullPointerException.class, () -> minimal().recipient(null).build());
        assertThrows(NullPointerException.class, () -> minimal().recipientEmail(null).build());
        assertThrows(NullPointerException.class, () -> minimal().cron(null).build());
        assertThrows(NullPointerException.class, () -> minimal().createdBy(null).build());
        assertThrows(IllegalArgumentException.class, () -> ScheduleDraft.builder()
                .recipient("Ada").recipientEmail("ada@example.com").endpoint("awesome")
                .cron("* * * * *").createdBy("alice").build());
    }

    @Test
    void materializedScheduleKeepsDraftFields() {
        ScheduleDraft draft = minimal().messageType(MessageType.META).from("Grace").build();
        Schedule schedule = Schedule.of("01HX", 42L, draft);

        assertEquals("01HX", schedule.id());
        assertEquals(42L, schedule.createdAt());
        assertEquals("meta", schedule.messageType());
        assertEquals("awesome", schedule.endpoint());
        assertEquals(100L, schedule.withNextRun(200L).withNextRun(100L).nextRun());
        assertEquals(200L, schedule.withNextRun(200L).nextRun());
    }

    @Test
    void toStringOmitsSensitiveFields() {
        Schedule schedule = Schedule.of("01HX", 42L, minimal()
                .deliveryMethod(DeliveryMethod.WEBHOOK)
                .webhookUrl("https://hooks.example.com/secret-path")
                .webhookSecret("s3cret")
                .build());

        String text = schedule.toString();
        assertFalse(text.contains("ada@example.com"));
        assertFalse(text.contains("secret-path"));
        assertFalse(text.contains("s3cret"));
        assertTrue(text.contains("01HX"));
    }

    @Test
    void deliveryMethodCodes() {
        assertEquals(DeliveryMethod.WEBHOOK, DeliveryMethod.fromCode("WEBHOOK"));
        assertEquals("email", DeliveryMethod.EMAIL.code());
        assertThrows(IllegalArgumentException.class, () -> DeliveryMethod.fromCode("sms"));
    }
}
