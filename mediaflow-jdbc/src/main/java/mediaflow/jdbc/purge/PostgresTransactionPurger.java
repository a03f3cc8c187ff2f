package mediaflow.jdbc.purge;

/**
 * PostgreSQL transaction purger. Uses the default subquery-based {@code DELETE}.
 */
public final class PostgresTransactionPurger extends AbstractJdbcTransactionPurger {

  public PostgresTransactionPurger() {
    super();
  }

  public PostgresTransactionPurger(String tableName) {
    super(tableName);
  }
}
