package io.kudos.spring.boot;

import io.kudos.ScheduleValidator;
import io.kudos.cron.UnixCronEvaluator;
import io.kudos.delivery.ConsoleEmailSender;
import io.kudos.delivery.ConsoleWebhookSender;
import io.kudos.delivery.EmailSender;
import io.kudos.delivery.HttpWebhookSender;
import io.kudos.delivery.WebhookSender;
import io.kudos.jdbc.store.H2ScheduleStore;
import io.kudos.message.TemplateMessageProducer;
import io.kudos.scheduler.DeliveryScheduler;
import io.kudos.spi.CronEvaluator;
import io.kudos.spi.MessageProducer;
import io.kudos.spi.ScheduleStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class KudosAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(KudosAutoConfiguration.class))
      .withPropertyValues("kudos.scheduler.poll-interval=PT1H");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("kudosClock"));
      assertTrue(ctx.containsBean("scheduleStore"));
      assertTrue(ctx.containsBean("deliveryScheduler"));

      assertInstanceOf(H2ScheduleStore.class, ctx.getBean(ScheduleStore.class));
      assertInstanceOf(UnixCronEvaluator.class, ctx.getBean(CronEvaluator.class));
      assertInstanceOf(TemplateMessageProducer.class, ctx.getBean(MessageProducer.class));
      assertInstanceOf(ConsoleEmailSender.class, ctx.getBean(EmailSender.class));
      assertInstanceOf(ConsoleWebhookSender.class, ctx.getBean(WebhookSender.class));
      assertNotNull(ctx.getBean(ScheduleValidator.class));
      assertTrue(ctx.getBean(DeliveryScheduler.class).isRunning());
    });
  }

  @Test
  void closingContextStopsSchedulerAndClosesStore() {
    AtomicReference<DeliveryScheduler> scheduler = new AtomicReference<>();
    AtomicReference<ScheduleStore> store = new AtomicReference<>();
    runner.run(ctx -> {
      scheduler.set(ctx.getBean(DeliveryScheduler.class));
      store.set(ctx.getBean(ScheduleStore.class));
    });

    assertFalse(scheduler.get().isRunning());
    assertThrows(IllegalStateException.class, () -> store.get().isTokenRevoked("jti"));
  }

  @Test
  void schedulerCanBeDisabled() {
    runner.withPropertyValues("kudos.scheduler.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("deliveryScheduler"));
      assertTrue(ctx.containsBean("scheduleStore"));
    });
  }

  @Test
  void liveModeWithoutMailSenderPostsWebhooksAndLogsEmail() {
    runner.withPropertyValues("kudos.delivery.mode=LIVE").run(ctx -> {
      assertInstanceOf(HttpWebhookSender.class, ctx.getBean(WebhookSender.class));
      assertInstanceOf(ConsoleEmailSender.class, ctx.getBean(EmailSender.class));
    });
  }

  @Test
  void liveModeUsesApplicationMailSender() {
    runner.withPropertyValues("kudos.delivery.mode=LIVE", "kudos.delivery.from=team@example.com")
        .withUserConfiguration(MailConfig.class)
        .run(ctx -> {
          EmailSender sender = ctx.getBean(EmailSender.class);
          assertInstanceOf(MailEmailSender.class, sender);

          assertTrue(sender.sendMessage("ada@example.com", "Ada", "Nice work"));
          RecordingMailSender mail = ctx.getBean(RecordingMailSender.class);
          assertEquals("team@example.com", mail.sent.get(0).getFrom());
        });
  }

  @Test
  void consoleModeIgnoresMailSender() {
    runner.withUserConfiguration(MailConfig.class).run(ctx -> {
      assertInstanceOf(ConsoleEmailSender.class, ctx.getBean(EmailSender.class));
    });
  }

  @Test
  void backsOffWhenUserProvidesBeans() {
    runner.withUserConfiguration(CustomBeansConfig.class).run(ctx -> {
      assertSame(CustomBeansConfig.EMAIL, ctx.getBean(EmailSender.class));
      assertSame(CustomBeansConfig.WEBHOOK, ctx.getBean(WebhookSender.class));
      assertFalse(ctx.containsBean("consoleEmailSender"));
    });
  }

  @Test
  void invalidPollIntervalFailsStartup() {
    runner.withPropertyValues("kudos.scheduler.poll-interval=PT0S").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class MailConfig {
    @Bean
    RecordingMailSender javaMailSender() {
      return new RecordingMailSender();
    }
  }

  @Configuration
  static class CustomBeansConfig {
    static final EmailSender EMAIL = (to, name, body) -> true;
    static final WebhookSender WEBHOOK = (url, payload, secret) -> true;

    @Bean
    EmailSender customEmailSender() {
      return EMAIL;
    }

    @Bean
    WebhookSender customWebhookSender() {
      return WEBHOOK;
    }
  }
}
