package io.kudos.micrometer;

import io.kudos.spi.SchedulerMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link SchedulerMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code kudos.delivery.success}: deliveries acknowledged by the sender</li>
 *   <li>{@code kudos.delivery.failure}: deliveries the sender reported as failed</li>
 *   <li>{@code kudos.schedule.error}: schedules whose processing threw</li>
 *   <li>{@code kudos.schedule.cron.invalid}: due schedules left unchanged because their cron no longer parses</li>
 *   <li>{@code kudos.revocation.purged}: revocation entries removed by cleanup</li>
 *   <li>{@code kudos.revocation.cleanup.failure}: failed cleanups (retried next poll)</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code kudos.poll.due}: size of the last due set</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code kudos.poll.duration.ms}: poll cycle duration</li>
 * </ul>
 *
 * @see SchedulerMetrics
 */
public final class MicrometerSchedulerMetrics implements SchedulerMetrics, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter deliverySuccess;
    private final Counter deliveryFailure;
    private final Counter scheduleError;
    private final Counter invalidCron;
    private final Counter revocationsPurged;
    private final Counter revocationCleanupFailure;
    private final Gauge dueGauge;
    private final DistributionSummary pollDuration;

    private final AtomicInteger dueSchedules = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates metrics with the default name prefix {@code "kudos"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerSchedulerMetrics(MeterRegistry registry) {
        this(registry, "kudos");
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names
     */
    public MicrometerSchedulerMetrics(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.deliverySuccess = Counter.builder(namePrefix + ".delivery.success")
                .description("Deliveries acknowledged by the sender")
                .register(registry);
        this.deliveryFailure = Counter.builder(namePrefix + ".delivery.failure")
                .description("Deliveries reported as failed (not retried)")
                .register(registry);
        this.scheduleError = Counter.builder(namePrefix + ".schedule.error")
                .description("Schedules whose processing threw")
                .register(registry);
        this.invalidCron = Counter.builder(namePrefix + ".schedule.cron.invalid")
                .description("Due schedules with an unparseable cron expression")
                .register(registry);
        this.revocationsPurged = Counter.builder(namePrefix + ".revocation.purged")
                .description("Revocation entries removed by cleanup")
                .register(registry);
        this.revocationCleanupFailure = Counter.builder(namePrefix + ".revocation.cleanup.failure")
                .description("Failed revocation cleanups")
                .register(registry);

        this.dueGauge = Gauge.builder(namePrefix + ".poll.due", dueSchedules, AtomicInteger::get)
                .register(registry);
        this.pollDuration = DistributionSummary.builder(namePrefix + ".poll.duration.ms")
                .description("Poll cycle duration in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementDeliverySuccess() {
        if (closed) return;
        deliverySuccess.increment();
    }

    @Override
    public void incrementDeliveryFailure() {
        if (closed) return;
        deliveryFailure.increment();
    }

    @Override
    public void incrementScheduleError() {
        if (closed) return;
        scheduleError.increment();
    }

    @Override
    public void incrementInvalidCron() {
        if (closed) return;
        invalidCron.increment();
    }

    @Override
    public void recordRevocationsPurged(int count) {
        if (closed) return;
        revocationsPurged.increment(count);
    }

    @Override
    public void incrementRevocationCleanupFailure() {
        if (closed) return;
        revocationCleanupFailure.increment();
    }

    @Override
    public void recordDueSchedules(int count) {
        if (closed) return;
        dueSchedules.set(count);
    }

    @Override
    public void recordPollDurationMs(long durationMs) {
        if (closed) return;
        pollDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this instance from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(deliverySuccess, deliveryFailure, scheduleError, invalidCron,
                revocationsPurged, revocationCleanupFailure, dueGauge, pollDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
