package io.kudos.spring.boot;

import io.kudos.micrometer.MicrometerSchedulerMetrics;
import io.kudos.spi.SchedulerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerSchedulerMetrics} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code kudos.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link KudosAutoConfiguration} so the {@link SchedulerMetrics} bean is
 * available to the delivery scheduler.
 */
@AutoConfiguration(before = KudosAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerSchedulerMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "kudos.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(KudosProperties.class)
public class KudosMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(SchedulerMetrics.class)
    public MicrometerSchedulerMetrics micrometerSchedulerMetrics(
            MeterRegistry meterRegistry, KudosProperties props) {
        return new MicrometerSchedulerMetrics(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
