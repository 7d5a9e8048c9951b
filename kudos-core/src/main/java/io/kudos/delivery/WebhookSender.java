package io.kudos.delivery;

/**
 * Delivers a message by POSTing a JSON payload to a webhook URL.
 *
 * <p>Implementations report failure through the return value and never throw for delivery
 * problems.
 *
 * @see HttpWebhookSender
 * @see ConsoleWebhookSender
 */
@FunctionalInterface
public interface WebhookSender {

    /**
     * @param url     the webhook target
     * @param payload the message payload
     * @param secret  HMAC secret for signing the body, or {@code null} to send unsigned
     * @return {@code true} if the target acknowledged the delivery
     */
    boolean sendMessage(String url, WebhookPayload payload, String secret);
}
