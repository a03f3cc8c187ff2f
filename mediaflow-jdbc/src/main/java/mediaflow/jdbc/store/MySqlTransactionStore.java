package mediaflow.jdbc.store;

import mediaflow.util.JsonCodec;

import java.util.List;

/**
 * MySQL transaction store. Also serves MariaDB and TiDB URLs.
 */
public final class MySqlTransactionStore extends AbstractJdbcTransactionStore {

  public MySqlTransactionStore() {
    super();
  }

  public MySqlTransactionStore(String tableName, String historyTableName) {
    super(tableName, historyTableName);
  }

  public MySqlTransactionStore(String tableName, String historyTableName, JsonCodec jsonCodec) {
    super(tableName, historyTableName, jsonCodec);
  }

  @Override
  public AbstractJdbcTransactionStore withJsonCodec(JsonCodec jsonCodec) {
    return new MySqlTransactionStore(tableName(), historyTableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }
}
