package io.kudos.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class KudosPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(KudosProperties.class);
            assertEquals(":memory:", props.getStore().getUrl());
            assertNull(props.getStore().getDataEncryptionKey());
            assertEquals(Duration.ofMinutes(5), props.getStore().getClaimTimeout());
            assertTrue(props.getScheduler().isEnabled());
            assertEquals(Duration.ofMinutes(1), props.getScheduler().getPollInterval());
            assertEquals(Duration.ofDays(30), props.getScheduler().getRevocationRetention());
            assertEquals(Duration.ofHours(6), props.getScheduler().getRevocationCleanupCadence());
            assertEquals(KudosProperties.DeliveryMode.CONSOLE, props.getDelivery().getMode());
            assertEquals("kudos@localhost", props.getDelivery().getFrom());
            assertTrue(props.getMessages().isToughLove());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("kudos", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "kudos.store.url=postgres://kudos@db/kudos",
                "kudos.store.data-encryption-key=secret",
                "kudos.store.claim-timeout=2m",
                "kudos.scheduler.enabled=false",
                "kudos.scheduler.poll-interval=30s",
                "kudos.scheduler.revocation-retention=7d",
                "kudos.scheduler.revocation-cleanup-cadence=1h",
                "kudos.delivery.mode=LIVE",
                "kudos.delivery.from=team@example.com",
                "kudos.messages.tough-love=false",
                "kudos.metrics.enabled=false",
                "kudos.metrics.name-prefix=team.kudos"
        ).run(ctx -> {
            var props = ctx.getBean(KudosProperties.class);
            assertEquals("postgres://kudos@db/kudos", props.getStore().getUrl());
            assertEquals("secret", props.getStore().getDataEncryptionKey());
            assertEquals(Duration.ofMinutes(2), props.getStore().getClaimTimeout());
            assertFalse(props.getScheduler().isEnabled());
            assertEquals(Duration.ofSeconds(30), props.getScheduler().getPollInterval());
            assertEquals(Duration.ofDays(7), props.getScheduler().getRevocationRetention());
            assertEquals(Duration.ofHours(1), props.getScheduler().getRevocationCleanupCadence());
            assertEquals(KudosProperties.DeliveryMode.LIVE, props.getDelivery().getMode());
            assertEquals("team@example.com", props.getDelivery().getFrom());
            assertFalse(props.getMessages().isToughLove());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("team.kudos", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(KudosProperties.class)
    static class PropsConfig {
    }
}
