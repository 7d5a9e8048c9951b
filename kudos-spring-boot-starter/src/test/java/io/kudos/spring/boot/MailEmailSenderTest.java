package io.kudos.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import static org.junit.jupiter.api.Assertions.*;

class MailEmailSenderTest {

    @Test
    void sendsPlainTextMessage() {
        RecordingMailSender mail = new RecordingMailSender();
        MailEmailSender sender = new MailEmailSender(mail, "kudos@example.com");

        assertTrue(sender.sendMessage("ada@example.com", "Ada", "Keep it up!"));

        assertEquals(1, mail.sent.size());
        SimpleMailMessage message = mail.sent.get(0);
        assertEquals("kudos@example.com", message.getFrom());
        assertArrayEquals(new String[]{"ada@example.com"}, message.getTo());
        assertEquals("Awesome Job, Ada!", message.getSubject());
        assertEquals("Keep it up!", message.getText());
    }

    @Test
    void mailFailureReportsFalse() {
        RecordingMailSender mail = new RecordingMailSender();
        mail.fail = true;

        assertFalse(new MailEmailSender(mail, "kudos@example.com").sendMessage("ada@example.com", "Ada", "hi"));
    }

    @Test
    void unexpectedSenderFailureReportsFalse() {
        JavaMailSenderImpl broken = new JavaMailSenderImpl() {
            @Override
            public void send(SimpleMailMessage... simpleMessages) {
                throw new IllegalStateException("session not configured");
            }
        };

        assertFalse(new MailEmailSender(broken, "kudos@example.com").sendMessage("ada@example.com", "Ada", "hi"));
    }

    @Test
    void requiresSenderAndFrom() {
        assertThrows(NullPointerException.class, () -> new MailEmailSender(null, "kudos@example.com"));
        assertThrows(NullPointerException.class, () -> new MailEmailSender(new RecordingMailSender(), null));
    }
}
