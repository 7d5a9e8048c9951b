package io.kudos.delivery;

import io.kudos.util.JsonCodec;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WebhookSender} that logs the payload instead of sending it. Always succeeds.
 */
public final class ConsoleWebhookSender implements WebhookSender {
    private static final Logger logger = Logger.getLogger(ConsoleWebhookSender.class.getName());

    @Override
    public boolean sendMessage(String url, WebhookPayload payload, String secret) {
        logger.log(Level.INFO, "[WEBHOOK] payload={0} signed={1}",
                new Object[]{payload.toJson(JsonCodec.getDefault()), secret != null && !secret.isEmpty()});
        return true;
    }
}
