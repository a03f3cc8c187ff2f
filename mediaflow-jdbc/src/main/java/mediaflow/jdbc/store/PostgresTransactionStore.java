package mediaflow.jdbc.store;

import mediaflow.util.JsonCodec;

import java.util.List;

/**
 * PostgreSQL transaction store.
 */
public final class PostgresTransactionStore extends AbstractJdbcTransactionStore {

  public PostgresTransactionStore() {
    super();
  }

  public PostgresTransactionStore(String tableName, String historyTableName) {
    super(tableName, historyTableName);
  }

  public PostgresTransactionStore(String tableName, String historyTableName, JsonCodec jsonCodec) {
    super(tableName, historyTableName, jsonCodec);
  }

  @Override
  public AbstractJdbcTransactionStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresTransactionStore(tableName(), historyTableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
