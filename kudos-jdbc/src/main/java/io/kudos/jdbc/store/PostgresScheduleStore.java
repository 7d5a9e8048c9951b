package io.kudos.jdbc.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.kudos.Schedule;
import io.kudos.crypto.FieldCodec;
import io.kudos.jdbc.JdbcTemplate;
import io.kudos.jdbc.ScheduleStoreException;

import javax.sql.DataSource;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PostgreSQL schedule store backed by a HikariCP pool.
 *
 * <p>{@link #getSchedulesDue} claims the returned rows for this store's owner id with
 * {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING} in a single round-trip, so concurrent
 * pollers sharing the database never receive the same due schedule. A claim is released by
 * {@link #updateScheduleNextRun}; a claim held by another owner is honored until it is older
 * than the claim timeout, after which the row becomes claimable again.
 */
public final class PostgresScheduleStore extends AbstractJdbcScheduleStore {
  private static final Logger logger = Logger.getLogger(PostgresScheduleStore.class.getName());

  static final String SCHEMA = "/schema/postgresql.sql";
  public static final Duration DEFAULT_CLAIM_TIMEOUT = Duration.ofMinutes(5);

  private final DataSource dataSource;
  private final boolean ownsDataSource;
  private final String ownerId;
  private final long claimTimeoutSeconds;
  private volatile boolean closed;

  /**
   * Creates a store on an existing data source. The caller keeps ownership of the data source.
   *
   * @param dataSource   the data source
   * @param codec        codec for sensitive columns
   * @param clock        source of timestamps
   * @param ownerId      claim owner for this instance, or {@code null} to generate one
   * @param claimTimeout how long another owner's claim is honored
   */
  public PostgresScheduleStore(DataSource dataSource, FieldCodec codec, Clock clock,
      String ownerId, Duration claimTimeout) {
    this(dataSource, false, codec, clock, ownerId, claimTimeout);
  }

  private PostgresScheduleStore(DataSource dataSource, boolean ownsDataSource, FieldCodec codec,
      Clock clock, String ownerId, Duration claimTimeout) {
    super(codec, clock);
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.ownsDataSource = ownsDataSource;
    Objects.requireNonNull(claimTimeout, "claimTimeout");
    if (claimTimeout.isNegative() || claimTimeout.isZero()) {
      throw new IllegalArgumentException("claimTimeout must be positive");
    }
    this.claimTimeoutSeconds = claimTimeout.getSeconds();
    this.ownerId = ownerId != null ? ownerId : "poller-" + UUID.randomUUID().toString().substring(0, 8);
    withConnection(conn -> {
      initSchema(conn, SCHEMA);
      return null;
    });
  }

  /**
   * Opens a pooled store for a {@code postgres://}, {@code postgresql://} or
   * {@code jdbc:postgresql:} URL.
   *
   * <p>The pool holds at most 10 connections, retires idle ones after 30 seconds and fails
   * acquisition after 5 seconds.
   *
   * @param url          the connection string
   * @param codec        codec for sensitive columns
   * @param clock        source of timestamps
   * @param claimTimeout how long another owner's claim is honored
   * @return the store, owning its pool
   */
  public static PostgresScheduleStore open(String url, FieldCodec codec, Clock clock, Duration claimTimeout) {
    HikariConfig config = hikariConfig(url);
    HikariDataSource pool = new HikariDataSource(config);
    try {
      PostgresScheduleStore store = new PostgresScheduleStore(pool, true, codec, clock, null, claimTimeout);
      logger.log(Level.INFO, "Opened pooled schedule store, owner {0}", store.ownerId);
      return store;
    } catch (RuntimeException e) {
      pool.close();
      throw e;
    }
  }

  static HikariConfig hikariConfig(String url) {
    HikariConfig config = new HikariConfig();
    config.setPoolName("kudos-pg");
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(0);
    config.setIdleTimeout(Duration.ofSeconds(30).toMillis());
    config.setConnectionTimeout(Duration.ofSeconds(5).toMillis());
    config.setAutoCommit(true);
    if (url.startsWith("jdbc:")) {
      config.setJdbcUrl(url);
      return config;
    }
    URI uri = URI.create(url);
    StringBuilder jdbcUrl = new StringBuilder("jdbc:postgresql://").append(uri.getHost());
    if (uri.getPort() > 0) {
      jdbcUrl.append(':').append(uri.getPort());
    }
    jdbcUrl.append(uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath());
    if (uri.getRawQuery() != null) {
      jdbcUrl.append('?').append(uri.getRawQuery());
    }
    config.setJdbcUrl(jdbcUrl.toString());
    String userInfo = uri.getRawUserInfo();
    if (userInfo != null) {
      int colon = userInfo.indexOf(':');
      if (colon < 0) {
        config.setUsername(decode(userInfo));
      } else {
        config.setUsername(decode(userInfo.substring(0, colon)));
        config.setPassword(decode(userInfo.substring(colon + 1)));
      }
    }
    return config;
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  public String ownerId() {
    return ownerId;
  }

  @Override
  protected <T> T withConnection(ConnectionCallback<T> callback) {
    if (closed) {
      throw new IllegalStateException("Schedule store is closed");
    }
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw new ScheduleStoreException("PostgreSQL operation failed", e);
    }
  }

  @Override
  protected String revokeTokenSql() {
    return "INSERT INTO revoked_tokens (jti, revoked_at) VALUES (?, ?) " +
        "ON CONFLICT (jti) DO UPDATE SET revoked_at = EXCLUDED.revoked_at";
  }

  @Override
  public List<Schedule> getSchedulesDue(long beforeTimestamp) {
    long now = nowSeconds();
    long claimExpiry = now - claimTimeoutSeconds;
    // Single round-trip: FOR UPDATE SKIP LOCKED + RETURNING
    String sql = "WITH claimed AS (" +
        "UPDATE schedules SET locked_by=?, locked_at=? " +
        "WHERE id IN (" +
        "SELECT id FROM schedules WHERE next_run <= ?" +
        " AND (locked_by IS NULL OR locked_by = ? OR locked_at < ?)" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + SCHEDULE_COLUMNS +
        ") SELECT " + SCHEDULE_COLUMNS + " FROM claimed ORDER BY next_run, id";
    return withConnection(conn -> JdbcTemplate.updateReturning(conn, sql, this::mapSchedule,
        ownerId, now, beforeTimestamp, ownerId, claimExpiry));
  }

  @Override
  public void updateScheduleNextRun(String id, long nextRun) {
    withConnection(conn -> JdbcTemplate.update(conn,
        "UPDATE schedules SET next_run=?, locked_by=NULL, locked_at=NULL WHERE id=?", nextRun, id));
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (ownsDataSource && dataSource instanceof HikariDataSource pool) {
      pool.close();
    }
  }
}
