package io.kudos.jdbc.store;

import io.kudos.crypto.FieldCodec;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Opens the schedule store matching a connection string.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Private in-memory database
 * ScheduleStore store = ScheduleStores.open(":memory:", dataKey);
 *
 * // Embedded database file
 * ScheduleStore store = ScheduleStores.open("./data/kudos", dataKey);
 *
 * // Shared PostgreSQL database, safe for several pollers
 * ScheduleStore store = ScheduleStores.open("postgres://kudos:secret@db:5432/kudos", dataKey);
 * }</pre>
 *
 * <p>{@code postgres://}, {@code postgresql://} and {@code jdbc:postgresql:} select
 * {@link PostgresScheduleStore}. Anything else selects {@link H2ScheduleStore}: {@code :memory:}
 * or an empty string opens a private in-memory database, a {@code jdbc:h2:} URL is used as-is,
 * and any other value is treated as a database file path.
 */
public final class ScheduleStores {
  public static final String MEMORY = ":memory:";

  private ScheduleStores() {
  }

  /**
   * Opens a store with the default claim timeout and the system UTC clock.
   *
   * @param url     the connection string, may be null for in-memory
   * @param dataKey the data encryption passphrase, or null/blank for plaintext storage
   * @return the opened store
   */
  public static AbstractJdbcScheduleStore open(String url, String dataKey) {
    return open(url, dataKey, PostgresScheduleStore.DEFAULT_CLAIM_TIMEOUT, Clock.systemUTC());
  }

  /**
   * @param url          the connection string, may be null for in-memory
   * @param dataKey      the data encryption passphrase, or null/blank for plaintext storage
   * @param claimTimeout how long another poller's claim is honored (PostgreSQL only)
   * @param clock        source of timestamps
   * @return the opened store
   */
  public static AbstractJdbcScheduleStore open(String url, String dataKey, Duration claimTimeout, Clock clock) {
    FieldCodec codec = FieldCodec.of(dataKey);
    if (isPostgres(url)) {
      return PostgresScheduleStore.open(url, codec, clock, claimTimeout);
    }
    return new H2ScheduleStore(h2JdbcUrl(url), codec, clock);
  }

  /**
   * @return {@code true} if the connection string selects the pooled PostgreSQL backend
   */
  public static boolean isPostgres(String url) {
    if (url == null) {
      return false;
    }
    String lower = url.toLowerCase(Locale.ROOT);
    return lower.startsWith("postgres://")
        || lower.startsWith("postgresql://")
        || lower.startsWith("jdbc:postgresql:");
  }

  static String h2JdbcUrl(String url) {
    if (url == null || url.isBlank() || MEMORY.equals(url.trim())) {
      return "jdbc:h2:mem:";
    }
    String trimmed = url.trim();
    if (trimmed.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
      return trimmed;
    }
    return "jdbc:h2:file:" + Path.of(trimmed).toAbsolutePath().normalize();
  }
}
