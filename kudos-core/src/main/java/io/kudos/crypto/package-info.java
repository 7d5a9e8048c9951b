/**
 * AES-256-GCM field encryption for sensitive schedule columns.
 */
package io.kudos.crypto;
