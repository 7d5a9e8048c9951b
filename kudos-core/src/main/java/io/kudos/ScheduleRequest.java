package io.kudos;

/**
 * Client-supplied fields of a new schedule, before validation.
 *
 * <p>Any field may be {@code null}; {@link ScheduleValidator} reports what is missing.
 * A {@code null} {@code deliveryMethod} means {@link DeliveryMethod#EMAIL}.
 */
public record ScheduleRequest(
        String recipient,
        String recipientEmail,
        String endpoint,
        String messageType,
        String from,
        String cron,
        DeliveryMethod deliveryMethod,
        String webhookUrl,
        String webhookSecret
) {
}
