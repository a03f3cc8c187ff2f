package mediaflow.jdbc.purge;

/**
 * H2 transaction purger. Uses the default subquery-based {@code DELETE}.
 */
public final class H2TransactionPurger extends AbstractJdbcTransactionPurger {

  public H2TransactionPurger() {
    super();
  }

  public H2TransactionPurger(String tableName) {
    super(tableName);
  }
}
