package io.kudos.spi;

import io.kudos.Schedule;

/**
 * Produces the message body for a firing schedule, selected by its endpoint and message type.
 *
 * @see io.kudos.message.TemplateMessageProducer
 */
@FunctionalInterface
public interface MessageProducer {

    /**
     * @param schedule the firing schedule
     * @return the message body
     */
    String produce(Schedule schedule);
}
