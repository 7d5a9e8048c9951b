package io.kudos.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.kudos.spi.CronEvaluator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CronEvaluator} for standard five-field UNIX cron expressions, evaluated in UTC.
 *
 * <p>Named weekdays and months are accepted ({@code "0 17 * * FRI"}). Parsing is delegated to
 * cron-utils.
 */
public final class UnixCronEvaluator implements CronEvaluator {
    private static final Logger logger = Logger.getLogger(UnixCronEvaluator.class.getName());

    private static final CronDefinition DEFINITION = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    private final CronParser parser = new CronParser(DEFINITION);
    private final Clock clock;

    public UnixCronEvaluator() {
        this(Clock.systemUTC());
    }

    public UnixCronEvaluator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Long calculateNextRun(String cronExpression) {
        return calculateNextRun(cronExpression, clock.instant());
    }

    /**
     * Returns the first occurrence strictly after {@code after}.
     *
     * @param cronExpression the expression
     * @param after          the reference instant
     * @return the next occurrence in unix seconds, or {@code null} if the expression is invalid
     */
    public Long calculateNextRun(String cronExpression, Instant after) {
        if (cronExpression == null || cronExpression.isBlank()) {
            logger.log(Level.WARNING, "Empty cron expression");
            return null;
        }
        try {
            Cron cron = parser.parse(cronExpression.trim());
            cron.validate();
            ExecutionTime executionTime = ExecutionTime.forCron(cron);
            Optional<ZonedDateTime> next = executionTime.nextExecution(after.atZone(ZoneOffset.UTC));
            if (next.isPresent() && !next.get().toInstant().isAfter(after)) {
                next = executionTime.nextExecution(after.plusSeconds(1).atZone(ZoneOffset.UTC));
            }
            if (next.isEmpty()) {
                logger.log(Level.WARNING, "Cron expression has no future occurrence: {0}", cronExpression);
                return null;
            }
            return next.get().toEpochSecond();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Invalid cron expression: " + cronExpression, e);
            return null;
        }
    }
}
