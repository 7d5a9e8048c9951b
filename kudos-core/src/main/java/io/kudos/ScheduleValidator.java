package io.kudos;

import io.kudos.spi.CronEvaluator;

import java.util.Objects;

/**
 * Validates schedule requests and computes their first occurrence.
 *
 * <p>Never throws for bad input: every rejection comes back as
 * {@link ValidationResult.Invalid}.
 */
public final class ScheduleValidator {
    private final CronEvaluator cronEvaluator;

    public ScheduleValidator(CronEvaluator cronEvaluator) {
        this.cronEvaluator = Objects.requireNonNull(cronEvaluator, "cronEvaluator");
    }

    /**
     * Validates a request on behalf of an owner.
     *
     * @param request   the client-supplied fields
     * @param createdBy the owner identifier
     * @return a valid result carrying the draft, or an invalid result with the reason
     */
    public ValidationResult validate(ScheduleRequest request, String createdBy) {
        if (request == null) {
            return ValidationResult.invalid("Request body is required");
        }
        if (isBlank(createdBy)) {
            return ValidationResult.invalid("Owner is required");
        }
        if (isBlank(request.recipient())) {
            return ValidationResult.invalid("recipient is required");
        }
        if (isBlank(request.recipientEmail())) {
            return ValidationResult.invalid("recipientEmail is required");
        }
        if (isBlank(request.endpoint())) {
            return ValidationResult.invalid("endpoint is required");
        }
        MessageEndpoint endpoint = MessageEndpoint.fromCode(request.endpoint());
        if (endpoint == null) {
            return ValidationResult.invalid("Unknown endpoint: " + request.endpoint());
        }
        if (endpoint == MessageEndpoint.MESSAGE && isBlank(request.messageType())) {
            return ValidationResult.invalid("messageType is required when endpoint is \"message\"");
        }
        if (!isBlank(request.messageType()) && MessageType.fromCode(request.messageType()) == null) {
            return ValidationResult.invalid("Unknown messageType: " + request.messageType());
        }
        DeliveryMethod method = request.deliveryMethod() == null ? DeliveryMethod.EMAIL : request.deliveryMethod();
        if (method == DeliveryMethod.WEBHOOK && isBlank(request.webhookUrl())) {
            return ValidationResult.invalid("webhookUrl is required when deliveryMethod is \"webhook\"");
        }
        if (isBlank(request.cron())) {
            return ValidationResult.invalid("cron is required");
        }
        Long nextRun = cronEvaluator.calculateNextRun(request.cron());
        if (nextRun == null) {
            return ValidationResult.invalid("Invalid cron expression");
        }

        return ValidationResult.valid(ScheduleDraft.builder()
                .recipient(request.recipient())
                .recipientEmail(request.recipientEmail())
                .endpoint(endpoint)
                .messageType(request.messageType())
                .from(request.from())
                .cron(request.cron())
                .nextRun(nextRun)
                .deliveryMethod(method)
                .webhookUrl(method == DeliveryMethod.WEBHOOK ? request.webhookUrl() : null)
                .webhookSecret(method == DeliveryMethod.WEBHOOK ? request.webhookSecret() : null)
                .createdBy(createdBy)
                .build());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
