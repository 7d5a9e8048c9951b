package io.kudos.spi;

/**
 * Computes the next occurrence of a five-field cron expression.
 *
 * @see io.kudos.cron.UnixCronEvaluator
 */
public interface CronEvaluator {

    /**
     * Returns the next UTC occurrence strictly after the current time.
     *
     * <p>Never throws. A {@code null} result means the expression is invalid (or has no future
     * occurrence) and callers must not schedule anything from it.
     *
     * @param cronExpression the expression, e.g. {@code "0 17 * * FRI"}
     * @return the next occurrence in unix seconds, or {@code null}
     */
    Long calculateNextRun(String cronExpression);
}
