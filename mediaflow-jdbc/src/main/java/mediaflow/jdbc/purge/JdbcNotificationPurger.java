package mediaflow.jdbc.purge;

import mediaflow.jdbc.LedgerSql;
import mediaflow.jdbc.TableNames;
import mediaflow.model.DeliveryStatus;
import mediaflow.spi.RecordPurger;

import java.sql.Connection;
import java.time.Instant;

/**
 * Purges abandoned notifications whose last delivery attempt is older than the cutoff.
 * Pending records are never touched.
 *
 * @see MySqlNotificationPurger
 */
public class JdbcNotificationPurger implements RecordPurger {
  private final String tableName;

  public JdbcNotificationPurger() {
    this(TableNames.DEFAULT_NOTIFICATION_TABLE);
  }

  public JdbcNotificationPurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  protected static String abandonedBefore() {
    return " WHERE delivery_status=" + DeliveryStatus.ABANDONED.code() +
        " AND COALESCE(last_attempt_at, created_at) < ?";
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
        "SELECT id FROM " + tableName() + abandonedBefore() +
        " ORDER BY created_at LIMIT ?)";
    return LedgerSql.execute(conn, sql, before, limit);
  }
}
