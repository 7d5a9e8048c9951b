/**
 * Kudos core: the schedule model, request validation and the public entry points.
 *
 * <p>Typical wiring:
 * <pre>{@code
 * ScheduleStore store = ScheduleStores.open(":memory:", System.getenv("DATA_ENCRYPTION_KEY"));
 * DeliveryScheduler scheduler = DeliveryScheduler.builder()
 *     .store(store)
 *     .emailSender(new ConsoleEmailSender())
 *     .build();
 * scheduler.start();
 * }</pre>
 *
 * @see io.kudos.scheduler.DeliveryScheduler
 * @see io.kudos.spi.ScheduleStore
 */
package io.kudos;
