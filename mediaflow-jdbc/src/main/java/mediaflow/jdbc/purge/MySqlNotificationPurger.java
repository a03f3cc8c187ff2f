package mediaflow.jdbc.purge;

import mediaflow.jdbc.LedgerSql;

import java.sql.Connection;
import java.time.Instant;

/**
 * MySQL variant of {@link JdbcNotificationPurger} using {@code DELETE ... ORDER BY ... LIMIT}.
 */
public final class MySqlNotificationPurger extends JdbcNotificationPurger {

  public MySqlNotificationPurger() {
    super();
  }

  public MySqlNotificationPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + abandonedBefore() + " ORDER BY created_at LIMIT ?";
    return LedgerSql.execute(conn, sql, before, limit);
  }
}
