/**
 * Delivery collaborators: e-mail and webhook senders with network and console implementations.
 */
package io.kudos.delivery;
