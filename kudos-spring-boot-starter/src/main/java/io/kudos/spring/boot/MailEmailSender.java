package io.kudos.spring.boot;

import io.kudos.delivery.EmailSender;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EmailSender} backed by Spring's {@link JavaMailSender}.
 */
public class MailEmailSender implements EmailSender {
    private static final Logger logger = Logger.getLogger(MailEmailSender.class.getName());

    private final JavaMailSender mailSender;
    private final String from;

    public MailEmailSender(JavaMailSender mailSender, String from) {
        this.mailSender = Objects.requireNonNull(mailSender, "mailSender");
        this.from = Objects.requireNonNull(from, "from");
    }

    @Override
    public boolean sendMessage(String toAddress, String recipientName, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(toAddress);
        message.setSubject("Awesome Job, " + recipientName + "!");
        message.setText(body);
        try {
            mailSender.send(message);
            return true;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "E-mail delivery failed", e);
            return false;
        }
    }
}
