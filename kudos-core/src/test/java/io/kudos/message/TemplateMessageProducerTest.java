package io.kudos.message;

import io.kudos.DeliveryMethod;
import io.kudos.MessageType;
import io.kudos.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TemplateMessageProducerTest {

    // Friday
    private static final Clock FRIDAY = Clock.fixed(Instant.parse("2024-05-17T12:00:00Z"), ZoneOffset.UTC);

    private final TemplateMessageProducer producer = new TemplateMessageProducer(true, FRIDAY, new Random(7));

    private static Schedule schedule(String endpoint, String messageType, String from) {
        return new Schedule("01HXYZ", "Ada", "ada@example.com", endpoint, messageType, from, "0 17 * * FRI",
                0L, DeliveryMethod.EMAIL, null, null, "owner", 0L);
    }

    @Test
    void awesomeEndpoint() {
        assertEquals("Awesome job, Ada!", producer.produce(schedule("awesome", null, null)));
        assertEquals("Awesome job, Ada! - Grace", producer.produce(schedule("awesome", null, "Grace")));
    }

    @Test
    void weeklyEndpointUsesUtcWeekday() {
        assertEquals("Awesome job this week, Ada. Take the next 2 days off.",
                producer.produce(schedule("weekly", null, null)));
    }

    @Test
    void daysOffByWeekday() {
        assertEquals(2, TemplateMessageProducer.daysOff(DayOfWeek.FRIDAY));
        assertEquals(3, TemplateMessageProducer.daysOff(DayOfWeek.THURSDAY));
        assertEquals(1, TemplateMessageProducer.daysOff(DayOfWeek.SATURDAY));
        assertEquals(1, TemplateMessageProducer.daysOff(DayOfWeek.SUNDAY));
        assertEquals(2, TemplateMessageProducer.daysOff(DayOfWeek.MONDAY));
    }

    @Test
    void randomEndpointSubstitutesName() {
        String message = producer.produce(schedule("random", null, "Grace"));

        assertTrue(message.contains("Ada"), message);
        assertFalse(message.contains(":name"), message);
        assertTrue(message.endsWith(" - Grace"), message);
    }

    @Test
    void typedMessageComesFromThatType() {
        for (int i = 0; i < 20; i++) {
            String message = producer.messageByType(MessageType.META, "Ada", null);
            assertTrue(templatesOf(MessageType.META).contains(message.replace("Ada", ":name")), message);
        }
    }

    @Test
    void unknownTypeFallsBackToRandom() {
        String message = producer.produce(schedule("message", "poem", null));

        assertTrue(message.contains("Ada"));
    }

    @Test
    void unknownEndpointFallsBackToSimpleMessage() {
        assertEquals("Awesome job, Ada!", producer.produce(schedule("shout", null, null)));
    }

    @Test
    void toughLoveCanBeDisabled() {
        TemplateMessageProducer gentle = new TemplateMessageProducer(false, FRIDAY, new Random(1));

        assertNull(gentle.messageByType(MessageType.TOUGH_LOVE, "Ada", null));
        assertFalse(gentle.availableTypes().contains(MessageType.TOUGH_LOVE));
        Set<String> toughLove = templatesOf(MessageType.TOUGH_LOVE);
        for (int i = 0; i < 50; i++) {
            String message = gentle.produce(schedule("message", "toughLove", null));
            assertFalse(toughLove.contains(message.replace("Ada", ":name")), message);
        }
    }

    @Test
    void allTypesAvailableByDefault() {
        assertEquals(Set.of(MessageType.values()), producer.availableTypes());
    }

    private static Set<String> templatesOf(MessageType type) {
        return MessageTemplates.ALL.stream()
                .filter(t -> t.type() == type)
                .map(MessageTemplates.MessageTemplate::template)
                .collect(java.util.stream.Collectors.toSet());
    }
}
