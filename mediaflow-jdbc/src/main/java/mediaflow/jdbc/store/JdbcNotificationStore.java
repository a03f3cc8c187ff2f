package mediaflow.jdbc.store;

import mediaflow.RecoveryData;
import mediaflow.jdbc.LedgerSql;
import mediaflow.jdbc.TableNames;
import mediaflow.model.DeliveryStatus;
import mediaflow.model.PendingNotification;
import mediaflow.spi.NotificationStore;
import mediaflow.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * JDBC notification store. The SQL is portable across H2, MySQL and PostgreSQL.
 */
public final class JdbcNotificationStore implements NotificationStore {
  private static final String COLUMNS =
      "id, transaction_id, destination, content, quoted_message_id, recovery_data, " +
      "attempts, created_at, last_attempt_at, delivery_status, last_error";

  private final String tableName;
  private final JsonCodec jsonCodec;

  public JdbcNotificationStore() {
    this(TableNames.DEFAULT_NOTIFICATION_TABLE, JsonCodec.getDefault());
  }

  public JdbcNotificationStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  public JdbcNotificationStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void insert(Connection conn, PendingNotification n) {
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    LedgerSql.execute(conn, sql,
        n.id(), n.transactionId(), n.destination(), n.content(), n.quotedMessageId(),
        n.recoveryData() == null ? null : jsonCodec.encode(n.recoveryData().toMap()),
        n.attempts(), n.createdAt(), n.lastAttemptAt(),
        n.deliveryStatus(), LedgerSql.errorText(n.lastError()));
  }

  @Override
  public List<PendingNotification> pollPending(Connection conn, Instant createdBefore, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE delivery_status=? AND created_at<=? ORDER BY created_at LIMIT ?";
    return LedgerSql.list(conn, sql, this::mapRow, DeliveryStatus.PENDING, createdBefore, limit);
  }

  @Override
  public int delete(Connection conn, String id) {
    return LedgerSql.execute(conn, "DELETE FROM " + tableName + " WHERE id=?", id);
  }

  @Override
  public int markAttempt(Connection conn, String id, Instant at, String error) {
    return transition(conn, id, DeliveryStatus.PENDING, at, error);
  }

  @Override
  public int markAbandoned(Connection conn, String id, Instant at, String error) {
    return transition(conn, id, DeliveryStatus.ABANDONED, at, error);
  }

  private int transition(Connection conn, String id, DeliveryStatus next, Instant at, String error) {
    String sql = "UPDATE " + tableName +
        " SET delivery_status=?, attempts=attempts+1, last_attempt_at=?, last_error=?" +
        " WHERE id=? AND delivery_status=?";
    return LedgerSql.execute(conn, sql, next, at, LedgerSql.errorText(error), id, DeliveryStatus.PENDING);
  }

  @Override
  public int resetToPending(Connection conn, String id) {
    String sql = "UPDATE " + tableName + " SET delivery_status=?, attempts=0" +
        " WHERE id=? AND delivery_status=?";
    return LedgerSql.execute(conn, sql, DeliveryStatus.PENDING, id, DeliveryStatus.ABANDONED);
  }

  @Override
  public List<PendingNotification> findByStatus(Connection conn, DeliveryStatus status, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE delivery_status=? ORDER BY created_at LIMIT ?";
    return LedgerSql.list(conn, sql, this::mapRow, status, limit);
  }

  @Override
  public int countByStatus(Connection conn, DeliveryStatus status) {
    String sql = "SELECT COUNT(*) FROM " + tableName + " WHERE delivery_status=?";
    return (int) LedgerSql.count(conn, sql, status);
  }

  @Override
  public boolean hasPending(Connection conn, String transactionId) {
    String sql = "SELECT COUNT(*) FROM " + tableName + " WHERE transaction_id=? AND delivery_status=?";
    return LedgerSql.count(conn, sql, transactionId, DeliveryStatus.PENDING) > 0;
  }

  private PendingNotification mapRow(ResultSet rs) throws SQLException {
    String recovery = rs.getString("recovery_data");
    return new PendingNotification(
        rs.getString("id"),
        rs.getString("transaction_id"),
        rs.getString("destination"),
        rs.getString("content"),
        rs.getString("quoted_message_id"),
        recovery == null ? null : RecoveryData.fromMap(jsonCodec.decode(recovery)),
        rs.getInt("attempts"),
        LedgerSql.instant(rs, "created_at"),
        LedgerSql.instant(rs, "last_attempt_at"),
        DeliveryStatus.fromCode(rs.getInt("delivery_status")),
        rs.getString("last_error"));
  }
}
