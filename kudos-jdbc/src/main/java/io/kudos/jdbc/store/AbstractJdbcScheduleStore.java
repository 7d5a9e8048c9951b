package io.kudos.jdbc.store;

import com.github.f4b6a3.ulid.UlidCreator;
import io.kudos.DeliveryMethod;
import io.kudos.Schedule;
import io.kudos.ScheduleDraft;
import io.kudos.crypto.FieldCodec;
import io.kudos.jdbc.JdbcTemplate;
import io.kudos.jdbc.ScheduleStoreException;
import io.kudos.spi.ScheduleStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC schedule store with standard SQL implementations.
 *
 * <p>Sensitive columns pass through a {@link FieldCodec} on every write and read. Subclasses
 * decide how connections are obtained ({@link #withConnection}), supply the revocation upsert,
 * and may override {@link #getSchedulesDue} to claim rows.
 *
 * @see ScheduleStores
 */
public abstract class AbstractJdbcScheduleStore implements ScheduleStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcScheduleStore.class.getName());

  protected static final String SCHEDULE_COLUMNS =
      "id, recipient, recipient_email, endpoint, message_type, from_name, cron, next_run, " +
      "delivery_method, webhook_url, webhook_secret, created_by, created_at";

  /** Callback executed with a connection owned by the store. */
  @FunctionalInterface
  protected interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }

  private final FieldCodec codec;
  private final Clock clock;

  protected AbstractJdbcScheduleStore(FieldCodec codec, Clock clock) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Unique identifier for this backend (e.g. "h2", "postgresql").
   */
  public abstract String name();

  /**
   * Runs the callback with a store-owned connection in auto-commit mode.
   *
   * @throws ScheduleStoreException if a connection cannot be obtained or the callback fails
   */
  protected abstract <T> T withConnection(ConnectionCallback<T> callback);

  /** SQL that inserts or refreshes a revocation, parameters {@code (jti, revoked_at)}. */
  protected abstract String revokeTokenSql();

  protected FieldCodec codec() {
    return codec;
  }

  protected long nowSeconds() {
    return clock.instant().getEpochSecond();
  }

  @Override
  public void revokeToken(String jti) {
    Objects.requireNonNull(jti, "jti");
    long now = nowSeconds();
    withConnection(conn -> JdbcTemplate.update(conn, revokeTokenSql(), jti, now));
  }

  @Override
  public boolean isTokenRevoked(String jti) {
    if (jti == null) {
      return false;
    }
    return withConnection(conn -> JdbcTemplate.queryOne(conn,
        "SELECT 1 FROM revoked_tokens WHERE jti=?", rs -> Boolean.TRUE, jti) != null);
  }

  @Override
  public int cleanupRevokedTokens(long olderThan) {
    return withConnection(conn -> JdbcTemplate.update(conn,
        "DELETE FROM revoked_tokens WHERE revoked_at < ?", olderThan));
  }

  @Override
  public Schedule createSchedule(ScheduleDraft draft) {
    Objects.requireNonNull(draft, "draft");
    String id = UlidCreator.getMonotonicUlid().toString();
    long createdAt = nowSeconds();
    String sql = "INSERT INTO schedules (" + SCHEDULE_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)";
    withConnection(conn -> JdbcTemplate.update(conn, sql,
        id, draft.recipient(), codec.encode(draft.recipientEmail()), draft.endpoint(),
        draft.messageType(), draft.from(), draft.cron(), draft.nextRun(),
        draft.deliveryMethod().code(), codec.encode(draft.webhookUrl()),
        codec.encode(draft.webhookSecret()), draft.createdBy(), createdAt));
    return Schedule.of(id, createdAt, draft);
  }

  @Override
  public Schedule getSchedule(String id) {
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE id=?";
    return withConnection(conn -> JdbcTemplate.queryOne(conn, sql, this::mapSchedule, id));
  }

  @Override
  public List<Schedule> getSchedulesDue(long beforeTimestamp) {
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE next_run <= ? ORDER BY next_run, id";
    return withConnection(conn -> JdbcTemplate.query(conn, sql, this::mapSchedule, beforeTimestamp));
  }

  @Override
  public void updateScheduleNextRun(String id, long nextRun) {
    withConnection(conn -> JdbcTemplate.update(conn,
        "UPDATE schedules SET next_run=? WHERE id=?", nextRun, id));
  }

  @Override
  public boolean deleteSchedule(String id) {
    return withConnection(conn -> JdbcTemplate.update(conn, "DELETE FROM schedules WHERE id=?", id)) > 0;
  }

  @Override
  public List<Schedule> listSchedules(String createdBy) {
    String order = " ORDER BY created_at DESC, id DESC";
    if (createdBy == null) {
      String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM schedules" + order;
      return withConnection(conn -> JdbcTemplate.query(conn, sql, this::mapSchedule));
    }
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM schedules WHERE created_by=?" + order;
    return withConnection(conn -> JdbcTemplate.query(conn, sql, this::mapSchedule, createdBy));
  }

  /**
   * Maps one {@code schedules} row, decrypting sensitive columns.
   */
  protected Schedule mapSchedule(ResultSet rs) throws SQLException {
    return new Schedule(
        rs.getString("id"),
        rs.getString("recipient"),
        codec.decode(rs.getString("recipient_email")),
        rs.getString("endpoint"),
        rs.getString("message_type"),
        rs.getString("from_name"),
        rs.getString("cron"),
        rs.getLong("next_run"),
        deliveryMethod(rs.getString("id"), rs.getString("delivery_method")),
        codec.decode(rs.getString("webhook_url")),
        codec.decode(rs.getString("webhook_secret")),
        rs.getString("created_by"),
        rs.getLong("created_at"));
  }

  /**
   * Maps a stored code; unknown codes read as {@link DeliveryMethod#EMAIL}.
   */
  private static DeliveryMethod deliveryMethod(String id, String code) {
    try {
      return DeliveryMethod.fromCode(code);
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Schedule {0} has unknown delivery method {1}; using email",
          new Object[]{id, code});
      return DeliveryMethod.EMAIL;
    }
  }

  /**
   * Creates tables, indexes and additive column migrations from a classpath DDL script.
   */
  protected static void initSchema(Connection conn, String resource) {
    JdbcTemplate.executeScript(conn, loadResource(resource));
  }

  private static String loadResource(String path) {
    try (InputStream is = AbstractJdbcScheduleStore.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IllegalStateException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + path, e);
    }
  }
}
