package io.kudos.message;

import io.kudos.MessageEndpoint;
import io.kudos.MessageType;
import io.kudos.Schedule;
import io.kudos.spi.MessageProducer;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Default {@link MessageProducer} backed by the built-in template set.
 *
 * <p>Endpoint handling:
 * <ul>
 *   <li>{@code awesome}: "Awesome job, NAME!"
 *   <li>{@code weekly}: days off computed from the current UTC weekday
 *   <li>{@code random}: any available template
 *   <li>{@code message}: a template of the schedule's type, or a random one when the type is
 *       missing, unknown or disabled
 *   <li>anything else: the {@code awesome} message
 * </ul>
 * A non-empty {@code from} is appended as {@code " - FROM"}.
 */
public final class TemplateMessageProducer implements MessageProducer {
    private final boolean includeToughLove;
    private final Clock clock;
    private final Random random;
    private final List<MessageTemplates.MessageTemplate> available;

    public TemplateMessageProducer() {
        this(true);
    }

    public TemplateMessageProducer(boolean includeToughLove) {
        this(includeToughLove, Clock.systemUTC(), null);
    }

    /**
     * @param includeToughLove whether tough-love templates may be chosen
     * @param clock            source of the current weekday for {@code weekly}
     * @param random           template picker, or {@code null} for {@link ThreadLocalRandom}
     */
    public TemplateMessageProducer(boolean includeToughLove, Clock clock, Random random) {
        this.includeToughLove = includeToughLove;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = random;
        this.available = includeToughLove
                ? MessageTemplates.ALL
                : MessageTemplates.ALL.stream().filter(t -> !t.isToughLove()).collect(Collectors.toList());
    }

    @Override
    public String produce(Schedule schedule) {
        String name = schedule.recipient();
        String from = schedule.from();
        MessageEndpoint endpoint = MessageEndpoint.fromCode(schedule.endpoint());
        if (endpoint == null) {
            return simpleMessage(name, from);
        }
        switch (endpoint) {
            case AWESOME:
                return simpleMessage(name, from);
            case WEEKLY:
                return weeklyMessage(name, from);
            case RANDOM:
                return randomMessage(name, from);
            case MESSAGE:
                String typed = messageByType(MessageType.fromCode(schedule.messageType()), name, from);
                return typed != null ? typed : randomMessage(name, from);
            default:
                return simpleMessage(name, from);
        }
    }

    public String simpleMessage(String name, String from) {
        return format("Awesome job, " + MessageTemplates.NAME_PLACEHOLDER + "!", name, from);
    }

    public String weeklyMessage(String name, String from) {
        int daysOff = daysOff(clock.instant().atZone(ZoneOffset.UTC).getDayOfWeek());
        return format("Awesome job this week, " + MessageTemplates.NAME_PLACEHOLDER
                + ". Take the next " + daysOff + " days off.", name, from);
    }

    public String randomMessage(String name, String from) {
        return format(pick(available).template(), name, from);
    }

    /**
     * @return a message of the given type, or {@code null} if the type is null, disabled or has
     *     no templates
     */
    public String messageByType(MessageType type, String name, String from) {
        if (type == null || (type == MessageType.TOUGH_LOVE && !includeToughLove)) {
            return null;
        }
        List<MessageTemplates.MessageTemplate> ofType = available.stream()
                .filter(t -> t.type() == type)
                .collect(Collectors.toList());
        if (ofType.isEmpty()) {
            return null;
        }
        return format(pick(ofType).template(), name, from);
    }

    /**
     * @return the message types that currently have at least one template
     */
    public Set<MessageType> availableTypes() {
        Set<MessageType> types = new LinkedHashSet<>();
        for (MessageTemplates.MessageTemplate template : available) {
            types.add(template.type());
        }
        return types;
    }

    static int daysOff(DayOfWeek day) {
        switch (day) {
            case FRIDAY:
                return 2;
            case THURSDAY:
                return 3;
            case SATURDAY:
            case SUNDAY:
                return 1;
            default:
                return 2;
        }
    }

    private MessageTemplates.MessageTemplate pick(List<MessageTemplates.MessageTemplate> templates) {
        int index = random != null
                ? random.nextInt(templates.size())
                : ThreadLocalRandom.current().nextInt(templates.size());
        return templates.get(index);
    }

    private static String format(String template, String name, String from) {
        String message = template.replace(MessageTemplates.NAME_PLACEHOLDER, name);
        if (from != null && !from.isEmpty()) {
            message += " - " + from;
        }
        return message;
    }
}
