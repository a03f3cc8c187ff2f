package mediaflow.jdbc.store;

import mediaflow.util.JsonCodec;

import java.util.List;

/**
 * H2 transaction store. Primarily for tests and embedded deployments.
 */
public final class H2TransactionStore extends AbstractJdbcTransactionStore {

  public H2TransactionStore() {
    super();
  }

  public H2TransactionStore(String tableName, String historyTableName) {
    super(tableName, historyTableName);
  }

  public H2TransactionStore(String tableName, String historyTableName, JsonCodec jsonCodec) {
    super(tableName, historyTableName, jsonCodec);
  }

  @Override
  public AbstractJdbcTransactionStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2TransactionStore(tableName(), historyTableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
