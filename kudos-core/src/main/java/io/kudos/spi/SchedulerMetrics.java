package io.kudos.spi;

/**
 * Observability hook for exporting delivery scheduler counters and gauges.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer or another monitoring system.
 */
public interface SchedulerMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    SchedulerMetrics NOOP = new Noop();

    /**
     * A delivery collaborator reported success.
     */
    void incrementDeliverySuccess();

    /**
     * A delivery collaborator reported failure (no retry follows).
     */
    void incrementDeliveryFailure();

    /**
     * Processing a due schedule threw.
     */
    void incrementScheduleError();

    /**
     * A due schedule's cron expression no longer parses, so {@code nextRun} was left unchanged.
     */
    void incrementInvalidCron();

    /**
     * Records the number of revocation entries purged by one cleanup.
     *
     * @param count entries removed
     */
    void recordRevocationsPurged(int count);

    /**
     * Revocation cleanup threw and will be retried on the next poll.
     */
    void incrementRevocationCleanupFailure();

    /**
     * Records the size of the due set fetched by the last poll.
     *
     * @param count due schedules
     */
    void recordDueSchedules(int count);

    /**
     * Records how long one poll cycle took.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordPollDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements SchedulerMetrics {
        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void incrementScheduleError() {
        }

        @Override
        public void incrementInvalidCron() {
        }

        @Override
        public void recordRevocationsPurged(int count) {
        }

        @Override
        public void incrementRevocationCleanupFailure() {
        }

        @Override
        public void recordDueSchedules(int count) {
        }
    }
}
