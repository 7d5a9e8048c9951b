package io.kudos.delivery;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EmailSender} that logs the message instead of sending it. Always succeeds.
 */
public final class ConsoleEmailSender implements EmailSender {
    private static final Logger logger = Logger.getLogger(ConsoleEmailSender.class.getName());

    @Override
    public boolean sendMessage(String toAddress, String recipientName, String body) {
        logger.log(Level.INFO, "[EMAIL] to={0} message={1}", new Object[]{recipientName, body});
        return true;
    }
}
