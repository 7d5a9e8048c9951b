/**
 * The delivery scheduler: a single-threaded poller that dispatches due schedules and purges the
 * revocation ledger.
 */
package io.kudos.scheduler;
