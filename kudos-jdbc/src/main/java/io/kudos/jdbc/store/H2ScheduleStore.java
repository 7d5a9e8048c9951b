package io.kudos.jdbc.store;

import io.kudos.crypto.FieldCodec;
import io.kudos.jdbc.ScheduleStoreException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Embedded H2 schedule store holding a single connection.
 *
 * <p>All operations are serialized on the store. Due schedules are returned without locking,
 * so exactly one poller may use a given database.
 */
public final class H2ScheduleStore extends AbstractJdbcScheduleStore {
  private static final Logger logger = Logger.getLogger(H2ScheduleStore.class.getName());

  static final String SCHEMA = "/schema/h2.sql";

  private final String jdbcUrl;
  private Connection connection;

  /**
   * Opens (and if needed creates) the database and its schema.
   *
   * @param jdbcUrl an H2 JDBC URL, e.g. {@code jdbc:h2:mem:} or {@code jdbc:h2:file:/var/lib/kudos/kudos}
   * @param codec   codec for sensitive columns
   * @param clock   source of creation and revocation timestamps
   * @throws ScheduleStoreException if the database cannot be opened
   */
  public H2ScheduleStore(String jdbcUrl, FieldCodec codec, Clock clock) {
    super(codec, clock);
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    try {
      this.connection = DriverManager.getConnection(jdbcUrl);
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      throw new ScheduleStoreException("Failed to open H2 database", e);
    }
    initSchema(connection, SCHEMA);
    logger.log(Level.INFO, "Opened embedded schedule store at {0}", jdbcUrl);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  protected synchronized <T> T withConnection(ConnectionCallback<T> callback) {
    if (connection == null) {
      throw new IllegalStateException("Schedule store is closed");
    }
    try {
      return callback.doInConnection(connection);
    } catch (SQLException e) {
      throw new ScheduleStoreException("H2 operation failed", e);
    }
  }

  @Override
  protected String revokeTokenSql() {
    return "MERGE INTO revoked_tokens (jti, revoked_at) KEY (jti) VALUES (?, ?)";
  }

  @Override
  public synchronized void close() {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close H2 connection for " + jdbcUrl, e);
    } finally {
      connection = null;
    }
  }
}
