package mediaflow.jdbc.purge;

import mediaflow.jdbc.LedgerSql;

import java.sql.Connection;
import java.time.Instant;

/**
 * MySQL transaction purger.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery on the table being deleted from,
 * so this variant uses {@code DELETE ... ORDER BY ... LIMIT}.
 */
public final class MySqlTransactionPurger extends AbstractJdbcTransactionPurger {

  public MySqlTransactionPurger() {
    super();
  }

  public MySqlTransactionPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN + " AND updated_at < ?" +
        " ORDER BY updated_at LIMIT ?";
    return LedgerSql.execute(conn, sql, before, limit);
  }
}
