package io.kudos.spring.boot;

import io.kudos.ScheduleValidator;
import io.kudos.cron.UnixCronEvaluator;
import io.kudos.delivery.ConsoleEmailSender;
import io.kudos.delivery.ConsoleWebhookSender;
import io.kudos.delivery.EmailSender;
import io.kudos.delivery.HttpWebhookSender;
import io.kudos.delivery.WebhookSender;
import io.kudos.jdbc.store.ScheduleStores;
import io.kudos.message.TemplateMessageProducer;
import io.kudos.scheduler.DeliveryScheduler;
import io.kudos.spi.CronEvaluator;
import io.kudos.spi.MessageProducer;
import io.kudos.spi.ScheduleStore;
import io.kudos.spi.SchedulerMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;

/**
 * Auto-configuration for the Kudos delivery scheduler.
 *
 * <p>Opens the {@link ScheduleStore} selected by {@code kudos.store.url}, wires the cron
 * evaluator, message producer and delivery senders, and starts a {@link DeliveryScheduler}
 * that is stopped when the context closes. In {@code LIVE} delivery mode e-mail goes through
 * the application's {@link JavaMailSender} when one is configured.
 *
 * @see KudosProperties
 * @see KudosMicrometerAutoConfiguration
 */
@AutoConfiguration(after = MailSenderAutoConfiguration.class)
@ConditionalOnClass(DeliveryScheduler.class)
@EnableConfigurationProperties(KudosProperties.class)
public class KudosAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock kudosClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore(KudosProperties props, Clock kudosClock) {
        KudosProperties.Store store = props.getStore();
        return ScheduleStores.open(store.getUrl(), store.getDataEncryptionKey(),
                store.getClaimTimeout(), kudosClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronEvaluator cronEvaluator(Clock kudosClock) {
        return new UnixCronEvaluator(kudosClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleValidator scheduleValidator(CronEvaluator cronEvaluator) {
        return new ScheduleValidator(cronEvaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageProducer messageProducer(KudosProperties props, Clock kudosClock) {
        return new TemplateMessageProducer(props.getMessages().isToughLove(), kudosClock, null);
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookSender webhookSender(KudosProperties props) {
        return switch (props.getDelivery().getMode()) {
            case CONSOLE -> new ConsoleWebhookSender();
            case LIVE -> new HttpWebhookSender();
        };
    }

    @Bean
    @ConditionalOnMissingBean(EmailSender.class)
    public ConsoleEmailSender consoleEmailSender() {
        return new ConsoleEmailSender();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "kudos.scheduler", name = "enabled", matchIfMissing = true)
    public DeliveryScheduler deliveryScheduler(KudosProperties props,
                                               ScheduleStore scheduleStore,
                                               CronEvaluator cronEvaluator,
                                               MessageProducer messageProducer,
                                               EmailSender emailSender,
                                               WebhookSender webhookSender,
                                               Clock kudosClock,
                                               ObjectProvider<SchedulerMetrics> metricsProvider) {
        KudosProperties.Scheduler scheduler = props.getScheduler();
        var builder = DeliveryScheduler.builder()
                .store(scheduleStore)
                .cronEvaluator(cronEvaluator)
                .messageProducer(messageProducer)
                .emailSender(emailSender)
                .webhookSender(webhookSender)
                .pollInterval(scheduler.getPollInterval())
                .revocationRetention(scheduler.getRevocationRetention())
                .revocationCleanupCadence(scheduler.getRevocationCleanupCadence())
                .clock(kudosClock);
        SchedulerMetrics metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    /**
     * Live e-mail delivery through Spring Mail. Registered before the console fallback.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.mail.javamail.JavaMailSender")
    @ConditionalOnBean(JavaMailSender.class)
    @ConditionalOnProperty(prefix = "kudos.delivery", name = "mode", havingValue = "LIVE")
    static class MailDeliveryConfiguration {

        @Bean
        @ConditionalOnMissingBean(EmailSender.class)
        public MailEmailSender mailEmailSender(JavaMailSender mailSender, KudosProperties props) {
            return new MailEmailSender(mailSender, props.getDelivery().getFrom());
        }
    }
}
