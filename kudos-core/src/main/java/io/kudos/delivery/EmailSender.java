package io.kudos.delivery;

/**
 * Delivers a message body by e-mail.
 *
 * <p>Implementations report failure through the return value and never throw for delivery
 * problems.
 *
 * @see ConsoleEmailSender
 */
@FunctionalInterface
public interface EmailSender {

    /**
     * @param toAddress     recipient e-mail address
     * @param recipientName recipient display name
     * @param body          message body
     * @return {@code true} if the message was handed off successfully
     */
    boolean sendMessage(String toAddress, String recipientName, String body);
}
