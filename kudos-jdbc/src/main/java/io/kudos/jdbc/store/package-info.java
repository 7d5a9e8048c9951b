/**
 * Schedule store implementations: an embedded H2 store and a pooled PostgreSQL store that
 * claims due rows for concurrent pollers.
 *
 * @see io.kudos.jdbc.store.ScheduleStores
 */
package io.kudos.jdbc.store;
