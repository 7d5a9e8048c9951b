/**
 * Service Provider Interfaces (SPI) consumed by the delivery scheduler.
 *
 * <p>Integrators implement these to plug in persistence, cron evaluation, message generation
 * and metrics.
 *
 * @see io.kudos.spi.ScheduleStore
 * @see io.kudos.spi.CronEvaluator
 * @see io.kudos.spi.MessageProducer
 * @see io.kudos.spi.SchedulerMetrics
 */
package io.kudos.spi;
