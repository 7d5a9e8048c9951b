package io.kudos;

import java.util.Objects;

/**
 * Persisted recurring delivery job, as returned by a {@link io.kudos.spi.ScheduleStore}.
 *
 * <p>Sensitive fields ({@code recipientEmail}, {@code webhookUrl}, {@code webhookSecret})
 * are always plaintext here; encryption happens at the store's row boundary.
 *
 * @param id             opaque identifier, assigned once at creation
 * @param recipient      display name of the recipient
 * @param recipientEmail recipient e-mail address
 * @param endpoint       message-generation mode code (see {@link MessageEndpoint})
 * @param messageType    message type code, or {@code null}
 * @param from           attribution appended to the message, or {@code null}
 * @param cron           five-field cron expression
 * @param nextRun        next occurrence in unix seconds
 * @param deliveryMethod how the message is delivered
 * @param webhookUrl     webhook target, or {@code null}
 * @param webhookSecret  HMAC secret for webhook signatures, or {@code null}
 * @param createdBy      owner identifier
 * @param createdAt      creation time in unix seconds, assigned once at creation
 */
public record Schedule(
        String id,
        String recipient,
        String recipientEmail,
        String endpoint,
        String messageType,
        String from,
        String cron,
        long nextRun,
        DeliveryMethod deliveryMethod,
        String webhookUrl,
        String webhookSecret,
        String createdBy,
        long createdAt
) {
    public Schedule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(deliveryMethod, "deliveryMethod");
    }

    /**
     * Materializes a draft into a persisted schedule.
     *
     * @param id        the generated identifier
     * @param createdAt the creation time in unix seconds
     * @param draft     the creation input
     * @return the full schedule
     */
    public static Schedule of(String id, long createdAt, ScheduleDraft draft) {
        return new Schedule(id, draft.recipient(), draft.recipientEmail(), draft.endpoint(),
                draft.messageType(), draft.from(), draft.cron(), draft.nextRun(),
                draft.deliveryMethod(), draft.webhookUrl(), draft.webhookSecret(),
                draft.createdBy(), createdAt);
    }

    /**
     * Returns a copy with a different {@code nextRun}.
     *
     * @param nextRun the new next occurrence in unix seconds
     * @return a new schedule
     */
    public Schedule withNextRun(long nextRun) {
        return new Schedule(id, recipient, recipientEmail, endpoint, messageType, from, cron,
                nextRun, deliveryMethod, webhookUrl, webhookSecret, createdBy, createdAt);
    }

    @Override
    public String toString() {
        // sensitive fields omitted
        return "Schedule[id=" + id + ", recipient=" + recipient + ", endpoint=" + endpoint
                + ", cron=" + cron + ", nextRun=" + nextRun + ", deliveryMethod=" + deliveryMethod
                + ", createdBy=" + createdBy + ", createdAt=" + createdAt + "]";
    }
}
