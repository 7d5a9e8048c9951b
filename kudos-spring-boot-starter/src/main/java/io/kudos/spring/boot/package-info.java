/**
 * Spring Boot auto-configuration for Kudos.
 *
 * <p>Binds {@code kudos.*} properties, opens the schedule store and runs the delivery
 * scheduler for the lifetime of the application context.
 *
 * @see io.kudos.spring.boot.KudosAutoConfiguration
 * @see io.kudos.spring.boot.KudosProperties
 */
package io.kudos.spring.boot;
