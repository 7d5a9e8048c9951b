package io.kudos.spi;

import io.kudos.Schedule;
import io.kudos.ScheduleDraft;

import java.util.List;

/**
 * Persistence contract for schedules and the token revocation ledger.
 *
 * <p>Implementations own their connection resources and encrypt sensitive columns
 * ({@code recipient_email}, {@code webhook_url}, {@code webhook_secret}) at the row boundary;
 * every {@link Schedule} returned carries plaintext values. All methods are fallible: storage
 * errors surface as unchecked exceptions.
 *
 * <p>Two implementations live in the {@code kudos-jdbc} module: an embedded single-connection
 * store for single-poller deployments and a pooled networked store that claims due rows so
 * several pollers can share one database.
 *
 * @see io.kudos.jdbc.store.AbstractJdbcScheduleStore
 */
public interface ScheduleStore extends AutoCloseable {

    /**
     * Records a token identifier as revoked. Repeated calls refresh the revocation time.
     *
     * @param jti the token identifier
     */
    void revokeToken(String jti);

    /**
     * Exact membership check. A revoked token stays revoked until purged by
     * {@link #cleanupRevokedTokens}.
     *
     * @param jti the token identifier
     * @return {@code true} if the identifier is in the ledger
     */
    boolean isTokenRevoked(String jti);

    /**
     * Deletes ledger entries revoked strictly before {@code olderThan}.
     *
     * @param olderThan cutoff in unix seconds
     * @return the number of entries removed
     */
    int cleanupRevokedTokens(long olderThan);

    /**
     * Persists a new schedule with a generated id and {@code createdAt = now}.
     *
     * @param draft the schedule fields
     * @return the stored schedule, plaintext
     */
    Schedule createSchedule(ScheduleDraft draft);

    /**
     * Loads one schedule.
     *
     * @param id the schedule id
     * @return the schedule, or {@code null} if unknown
     */
    Schedule getSchedule(String id);

    /**
     * Returns every schedule with {@code nextRun <= beforeTimestamp}.
     *
     * <p>Stores that support several concurrent pollers atomically claim the returned rows and
     * skip rows claimed by other pollers, so no two pollers receive the same due schedule.
     * The embedded store does not lock and assumes a single active poller.
     *
     * @param beforeTimestamp inclusive upper bound in unix seconds
     * @return due schedules, plaintext
     */
    List<Schedule> getSchedulesDue(long beforeTimestamp);

    /**
     * Overwrites {@code nextRun} only. Stores that claim rows release the claim here.
     *
     * @param id      the schedule id
     * @param nextRun the next occurrence in unix seconds
     */
    void updateScheduleNextRun(String id, long nextRun);

    /**
     * Deletes one schedule.
     *
     * @param id the schedule id
     * @return {@code true} if a schedule was deleted
     */
    boolean deleteSchedule(String id);

    /**
     * Lists schedules newest first.
     *
     * @param createdBy owner filter, or {@code null} for all schedules
     * @return matching schedules ordered by {@code createdAt} descending
     */
    List<Schedule> listSchedules(String createdBy);

    /**
     * Releases all resources. Idempotent.
     */
    @Override
    void close();
}
