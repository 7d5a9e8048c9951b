package io.kudos.scheduler;

import io.kudos.DeliveryMethod;
import io.kudos.Schedule;
import io.kudos.cron.UnixCronEvaluator;
import io.kudos.delivery.EmailSender;
import io.kudos.delivery.HttpWebhookSender;
import io.kudos.delivery.WebhookPayload;
import io.kudos.delivery.WebhookSender;
import io.kudos.message.TemplateMessageProducer;
import io.kudos.spi.CronEvaluator;
import io.kudos.spi.MessageProducer;
import io.kudos.spi.ScheduleStore;
import io.kudos.spi.SchedulerMetrics;
import io.kudos.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recurring poller that delivers due schedules and periodically purges the revocation ledger.
 *
 * <p>Each cycle ({@link #pollOnce()}):
 * <ol>
 *   <li>purges revocations older than the retention window, at most once per cleanup cadence
 *       (a failed purge is retried on the next cycle);
 *   <li>fetches every schedule due at the cycle's {@code now};
 *   <li>for each, sequentially: produces the body, dispatches it by webhook or e-mail, computes
 *       the next occurrence and writes it back.
 * </ol>
 * A failure in one schedule is logged and does not affect its siblings. {@code nextRun} advances
 * whether or not the delivery reported success; failed deliveries are not retried. When a
 * stored cron expression no longer parses, {@code nextRun} is left unchanged and the schedule
 * stays due on every cycle.
 *
 * <p>Overlapping cycles are skipped. Cross-process exclusion comes from the store's claiming.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #stop()} are
 * synchronized; a stopped scheduler may be started again.
 *
 * @see DeliveryScheduler.Builder
 */
public final class DeliveryScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DeliveryScheduler.class.getName());

    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final ScheduleStore store;
    private final CronEvaluator cronEvaluator;
    private final MessageProducer messageProducer;
    private final EmailSender emailSender;
    private final WebhookSender webhookSender;
    private final Duration pollInterval;
    private final Duration revocationRetention;
    private final Duration revocationCleanupCadence;
    private final Clock clock;
    private final SchedulerMetrics metrics;
    private final AtomicBoolean polling = new AtomicBoolean();

    private volatile Instant lastRevocationCleanup = Instant.EPOCH;
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pollTask;

    private DeliveryScheduler(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.emailSender = Objects.requireNonNull(builder.emailSender, "emailSender");

        Duration pollInterval = builder.pollInterval;
        Duration retention = builder.revocationRetention;
        Duration cadence = builder.revocationCleanupCadence;
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (retention.isNegative()) {
            throw new IllegalArgumentException("revocationRetention must be >= 0");
        }
        if (cadence.isNegative()) {
            throw new IllegalArgumentException("revocationCleanupCadence must be >= 0");
        }

        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.cronEvaluator = builder.cronEvaluator != null ? builder.cronEvaluator : new UnixCronEvaluator(clock);
        this.messageProducer = builder.messageProducer != null
                ? builder.messageProducer
                : new TemplateMessageProducer(true, clock, null);
        this.webhookSender = builder.webhookSender != null ? builder.webhookSender : new HttpWebhookSender();
        this.metrics = builder.metrics != null ? builder.metrics : SchedulerMetrics.NOOP;
        this.pollInterval = pollInterval;
        this.revocationRetention = retention;
        this.revocationCleanupCadence = cadence;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs one cycle immediately, then one every poll interval on a daemon thread.
     * No-op if already running.
     */
    public synchronized void start() {
        if (pollTask != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("kudos-scheduler-"));
        long intervalMs = pollInterval.toMillis();
        pollTask = executor.scheduleWithFixedDelay(this::pollOnce, 0, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Delivery scheduler started, polling every {0}", pollInterval);
    }

    /**
     * Cancels future cycles and waits for an in-flight cycle to finish. Idempotent.
     */
    public synchronized void stop() {
        if (pollTask == null) {
            return;
        }
        pollTask.cancel(false);
        pollTask = null;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.log(Level.WARNING, "Poll cycle still running after {0}s; interrupting", STOP_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        logger.log(Level.INFO, "Delivery scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return pollTask != null;
    }

    /** Same as {@link #stop()}. */
    @Override
    public void close() {
        stop();
    }

    /**
     * Executes a single cycle. Called by the timer, and may be invoked directly for testing.
     * Returns immediately if another cycle is in progress.
     */
    public void pollOnce() {
        if (!polling.compareAndSet(false, true)) {
            logger.log(Level.FINE, "Previous poll cycle still running; skipping");
            return;
        }
        long startNanos = System.nanoTime();
        try {
            Instant now = clock.instant();
            maybeCleanupRevocations(now);

            List<Schedule> due = fetchDue(now.getEpochSecond());
            if (due == null) {
                return;
            }
            metrics.recordDueSchedules(due.size());
            for (Schedule schedule : due) {
                executeSchedule(schedule);
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed", t);
        } finally {
            metrics.recordPollDurationMs(Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)));
            polling.set(false);
        }
    }

    Instant lastRevocationCleanup() {
        return lastRevocationCleanup;
    }

    private void maybeCleanupRevocations(Instant now) {
        if (Duration.between(lastRevocationCleanup, now).compareTo(revocationCleanupCadence) < 0) {
            return;
        }
        long olderThan = now.minus(revocationRetention).getEpochSecond();
        try {
            int removed = store.cleanupRevokedTokens(olderThan);
            lastRevocationCleanup = now;
            metrics.recordRevocationsPurged(removed);
            if (removed > 0) {
                logger.log(Level.INFO, "Purged {0} revoked tokens older than {1}",
                        new Object[]{removed, Instant.ofEpochSecond(olderThan)});
            }
        } catch (RuntimeException e) {
            metrics.incrementRevocationCleanupFailure();
            logger.log(Level.SEVERE, "Failed to purge revoked tokens", e);
        }
    }

    /**
     * Returns {@code null} on failure (to distinguish from an empty due set).
     */
    private List<Schedule> fetchDue(long nowSeconds) {
        try {
            return store.getSchedulesDue(nowSeconds);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch due schedules", e);
            return null;
        }
    }

    private void executeSchedule(Schedule schedule) {
        dispatch(schedule);
        reschedule(schedule);
    }

    private void dispatch(Schedule schedule) {
        try {
            String body = messageProducer.produce(schedule);
            boolean delivered = deliver(schedule, body);
            if (delivered) {
                metrics.incrementDeliverySuccess();
                logger.log(Level.INFO, "Delivered schedule {0}", schedule.id());
            } else {
                metrics.incrementDeliveryFailure();
                logger.log(Level.WARNING, "Delivery failed for schedule {0}", schedule.id());
            }
        } catch (Throwable t) {
            metrics.incrementScheduleError();
            logger.log(Level.SEVERE, "Failed to deliver schedule " + schedule.id(), t);
        }
    }

    /**
     * Advances {@code nextRun} whatever the delivery outcome, so an occurrence is dispatched at most once.
     */
    private void reschedule(Schedule schedule) {
        try {
            Long nextRun = cronEvaluator.calculateNextRun(schedule.cron());
            if (nextRun == null) {
                metrics.incrementInvalidCron();
                logger.log(Level.WARNING, "Schedule {0} has an invalid cron expression; nextRun unchanged",
                        schedule.id());
                return;
            }
            store.updateScheduleNextRun(schedule.id(), nextRun);
            logger.log(Level.FINE, "Next run for schedule {0}: {1}",
                    new Object[]{schedule.id(), Instant.ofEpochSecond(nextRun)});
        } catch (Throwable t) {
            metrics.incrementScheduleError();
            logger.log(Level.SEVERE, "Failed to reschedule schedule " + schedule.id(), t);
        }
    }

    private boolean deliver(Schedule schedule, String body) {
        if (schedule.deliveryMethod() == DeliveryMethod.WEBHOOK
                && schedule.webhookUrl() != null && !schedule.webhookUrl().isEmpty()) {
            WebhookPayload payload = new WebhookPayload(schedule.recipient(), body, schedule.endpoint(),
                    schedule.messageType(), schedule.from(), clock.instant());
            return webhookSender.sendMessage(schedule.webhookUrl(), payload, schedule.webhookSecret());
        }
        return emailSender.sendMessage(schedule.recipientEmail(), schedule.recipient(), body);
    }

    /**
     * Builder for {@link DeliveryScheduler}.
     */
    public static final class Builder {
        private ScheduleStore store;
        private CronEvaluator cronEvaluator;
        private MessageProducer messageProducer;
        private EmailSender emailSender;
        private WebhookSender webhookSender;
        private Duration pollInterval = Duration.ofSeconds(60);
        private Duration revocationRetention = Duration.ofDays(30);
        private Duration revocationCleanupCadence = Duration.ofHours(6);
        private Clock clock;
        private SchedulerMetrics metrics;

        private Builder() {
        }

        /**
         * Sets the schedule store to poll and update.
         *
         * <p><b>Required.</b>
         *
         * @param store the persistence backend
         * @return this builder
         */
        public Builder store(ScheduleStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the evaluator used to compute each schedule's next occurrence.
         *
         * <p>Optional. Defaults to a {@link UnixCronEvaluator} on the scheduler clock.
         *
         * @param cronEvaluator the cron evaluator
         * @return this builder
         */
        public Builder cronEvaluator(CronEvaluator cronEvaluator) {
            this.cronEvaluator = cronEvaluator;
            return this;
        }

        /**
         * Sets the producer of message bodies.
         *
         * <p>Optional. Defaults to {@link TemplateMessageProducer} with tough-love enabled.
         *
         * @param messageProducer the message producer
         * @return this builder
         */
        public Builder messageProducer(MessageProducer messageProducer) {
            this.messageProducer = messageProducer;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param emailSender sender for e-mail deliveries
         * @return this builder
         */
        public Builder emailSender(EmailSender emailSender) {
            this.emailSender = emailSender;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link HttpWebhookSender}.
         *
         * @param webhookSender sender for webhook deliveries
         * @return this builder
         */
        public Builder webhookSender(WebhookSender webhookSender) {
            this.webhookSender = webhookSender;
            return this;
        }

        /**
         * Sets the delay between the end of one cycle and the start of the next.
         *
         * <p>Optional. Defaults to 60 seconds. Must be &gt; 0.
         *
         * @param pollInterval the poll interval
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
            return this;
        }

        /**
         * Sets how long revocations are kept before cleanup removes them.
         *
         * <p>Optional. Defaults to 30 days. Must be &ge; 0.
         *
         * @param revocationRetention the retention window
         * @return this builder
         */
        public Builder revocationRetention(Duration revocationRetention) {
            this.revocationRetention = Objects.requireNonNull(revocationRetention, "revocationRetention");
            return this;
        }

        /**
         * Sets the minimum time between two successful revocation cleanups.
         *
         * <p>Optional. Defaults to 6 hours. Must be &ge; 0.
         *
         * @param revocationCleanupCadence the cleanup cadence
         * @return this builder
         */
        public Builder revocationCleanupCadence(Duration revocationCleanupCadence) {
            this.revocationCleanupCadence = Objects.requireNonNull(revocationCleanupCadence,
                    "revocationCleanupCadence");
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock source of "now" for due queries, cleanup cutoffs and webhook timestamps
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link SchedulerMetrics#NOOP}.
         *
         * @param metrics the metrics sink
         * @return this builder
         */
        public Builder metrics(SchedulerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the scheduler. Call {@link DeliveryScheduler#start()} to begin.
         *
         * @return a new {@link DeliveryScheduler}
         * @throws NullPointerException     if {@code store} or {@code emailSender} is null
         * @throws IllegalArgumentException if {@code pollInterval <= 0} or a revocation duration is negative
         */
        public DeliveryScheduler build() {
            return new DeliveryScheduler(this);
        }
    }
}
