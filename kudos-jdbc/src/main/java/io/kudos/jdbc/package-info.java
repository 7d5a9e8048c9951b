/**
 * JDBC persistence for schedules and the revocation ledger.
 *
 * @see io.kudos.jdbc.store.ScheduleStores
 */
package io.kudos.jdbc;
