package io.kudos.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link io.kudos.jdbc.store.AbstractJdbcScheduleStore} and its subclasses.
 */
public final class ScheduleStoreException extends RuntimeException {
  public ScheduleStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
