package io.kudos.delivery;

import io.kudos.util.JsonCodec;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Body of a webhook delivery.
 *
 * @param recipient   recipient display name
 * @param message     message body
 * @param endpoint    endpoint code that produced the message
 * @param messageType message type code, or {@code null}
 * @param from        attribution, or {@code null}
 * @param timestamp   delivery time
 */
public record WebhookPayload(
        String recipient,
        String message,
        String endpoint,
        String messageType,
        String from,
        Instant timestamp
) {
    public WebhookPayload {
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Serializes the payload with fields in declaration order; absent optional fields are
     * omitted and the timestamp is ISO-8601 UTC.
     *
     * @param codec the JSON codec
     * @return the JSON body
     */
    public String toJson(JsonCodec codec) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("recipient", recipient);
        fields.put("message", message);
        fields.put("endpoint", endpoint);
        fields.put("messageType", messageType);
        fields.put("from", from);
        fields.put("timestamp", timestamp.toString());
        return codec.toJson(fields);
    }
}
