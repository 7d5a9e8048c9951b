/**
 * Micrometer bridge for delivery scheduler metrics.
 *
 * @see io.kudos.micrometer.MicrometerSchedulerMetrics
 */
package io.kudos.micrometer;
