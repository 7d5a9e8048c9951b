package io.kudos.spring.boot;

import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * JavaMailSender that records simple messages instead of talking to an SMTP server.
 */
class RecordingMailSender extends JavaMailSenderImpl {
    final List<SimpleMailMessage> sent = new CopyOnWriteArrayList<>();
    volatile boolean fail;

    @Override
    public void send(SimpleMailMessage... simpleMessages) {
        if (fail) {
            throw new MailSendException("smtp unavailable");
        }
        sent.addAll(List.of(simpleMessages));
    }
}
