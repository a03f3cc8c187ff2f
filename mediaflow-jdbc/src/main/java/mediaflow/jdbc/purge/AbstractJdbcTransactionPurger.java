package mediaflow.jdbc.purge;

import mediaflow.jdbc.LedgerSql;
import mediaflow.jdbc.TableNames;
import mediaflow.model.TransactionStatus;
import mediaflow.spi.RecordPurger;

import java.sql.Connection;
import java.time.Instant;

/**
 * Base JDBC purger for transactions in a terminal status ({@code DELIVERED} or
 * {@code FAILURE_PERMANENT}) whose last update is older than the cutoff.
 *
 * <p>History rows go with their transaction through the {@code ON DELETE CASCADE} foreign key
 * declared by the bundled schemas. Default SQL uses a subquery-limited {@code DELETE} that works
 * for H2 and PostgreSQL; MySQL overrides with {@code DELETE ... ORDER BY ... LIMIT}.
 *
 * @see H2TransactionPurger
 * @see MySqlTransactionPurger
 * @see PostgresTransactionPurger
 */
public abstract class AbstractJdbcTransactionPurger implements RecordPurger {
  protected static final String TERMINAL_STATUS_IN = LedgerSql.codes(TransactionStatus.terminal());

  private final String tableName;

  protected AbstractJdbcTransactionPurger() {
    this(TableNames.DEFAULT_TRANSACTION_TABLE);
  }

  protected AbstractJdbcTransactionPurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE status IN " + TERMINAL_STATUS_IN + " AND updated_at < ?" +
        " ORDER BY updated_at LIMIT ?)";
    return LedgerSql.execute(conn, sql, before, limit);
  }
}
