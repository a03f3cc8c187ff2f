package mediaflow.jdbc.store;

import mediaflow.MediaKind;
import mediaflow.RecoveryData;
import mediaflow.jdbc.LedgerSql;
import mediaflow.jdbc.TableNames;
import mediaflow.model.HistoryEntry;
import mediaflow.model.Transaction;
import mediaflow.model.TransactionStatus;
import mediaflow.spi.TransactionStore;
import mediaflow.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Base JDBC transaction store with standard SQL implementations.
 *
 * <p>Transactions live in one table and their history in a second, append-only table keyed by
 * an identity column so entries read back in insertion order. Every status change is a single
 * {@code UPDATE ... WHERE status IN (...)} statement.
 *
 * <p>Subclasses name the dialect and the JDBC URL prefixes they serve. Register custom
 * implementations via {@code META-INF/services/mediaflow.jdbc.store.AbstractJdbcTransactionStore}.
 *
 * @see JdbcTransactionStores
 */
public abstract class AbstractJdbcTransactionStore implements TransactionStore {
  private static final String COLUMNS =
      "id, submission_id, conversation_id, origin_id, kind, status, attempts, " +
      "recovery_data, response, last_error, created_at, updated_at";

  private static final String RECOVERABLE_STATUS_IN = LedgerSql.codes(TransactionStatus.recoverable());

  private final String tableName;
  private final String historyTableName;
  private final JsonCodec jsonCodec;
  private final LedgerSql.RowMapper<Transaction> rowMapper;

  protected AbstractJdbcTransactionStore() {
    this(TableNames.DEFAULT_TRANSACTION_TABLE, TableNames.DEFAULT_HISTORY_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcTransactionStore(String tableName, String historyTableName) {
    this(tableName, historyTableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcTransactionStore(String tableName, String historyTableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.historyTableName = TableNames.validate(historyTableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = this::mapRow;
  }

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store that encodes recovery data with the given codec.
   */
  public abstract AbstractJdbcTransactionStore withJsonCodec(JsonCodec jsonCodec);

  protected String tableName() {
    return tableName;
  }

  protected String historyTableName() {
    return historyTableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  @Override
  public void insert(Connection conn, Transaction transaction) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    LedgerSql.execute(conn, sql,
        transaction.id(), transaction.submissionId(), transaction.conversationId(),
        transaction.originId(), transaction.kind(), transaction.status(), transaction.attempts(),
        encodeRecovery(transaction.recoveryData()), transaction.response(),
        LedgerSql.errorText(transaction.lastError()),
        transaction.createdAt(), transaction.updatedAt());
    for (HistoryEntry entry : transaction.history()) {
      appendHistory(conn, transaction.id(), entry);
    }
  }

  @Override
  public Optional<Transaction> find(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return LedgerSql.single(conn, sql, rowMapper, id)
        .map(tx -> tx.withHistory(loadHistory(conn, id)));
  }

  @Override
  public int updateStatus(Connection conn, String id, Set<TransactionStatus> expected,
      TransactionStatus next, Instant at) {
    if (expected.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + tableName() + " SET status=?, updated_at=?" +
        " WHERE id=? AND status IN " + LedgerSql.codes(expected);
    return LedgerSql.execute(conn, sql, next, at, id);
  }

  @Override
  public int setResponse(Connection conn, String id, String response, Set<TransactionStatus> expected,
      TransactionStatus next, Instant at) {
    if (expected.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + tableName() + " SET response=?, status=?, updated_at=?" +
        " WHERE id=? AND response IS NULL AND status IN " + LedgerSql.codes(expected);
    return LedgerSql.execute(conn, sql, response, next, at, id);
  }

  @Override
  public int setRecoveryData(Connection conn, String id, RecoveryData recoveryData,
      Set<TransactionStatus> expected, Instant at) {
    if (expected.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + tableName() + " SET recovery_data=?, updated_at=?" +
        " WHERE id=? AND status IN " + LedgerSql.codes(expected);
    return LedgerSql.execute(conn, sql, encodeRecovery(recoveryData), at, id);
  }

  /**
   * {@inheritDoc}
   *
   * <p>The status assignment comes first and reads the pre-increment counter. MySQL applies
   * {@code SET} clauses left to right, so the order matters there.
   */
  @Override
  public int recordFailure(Connection conn, String id, String error, int permanentThreshold,
      Set<TransactionStatus> expected, Instant at) {
    if (expected.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + tableName() +
        " SET status=CASE WHEN attempts+1>=? THEN " + TransactionStatus.FAILURE_PERMANENT.code() +
        " ELSE " + TransactionStatus.FAILURE_TEMPORARY.code() + " END," +
        " attempts=attempts+1, last_error=?, updated_at=?" +
        " WHERE id=? AND status IN " + LedgerSql.codes(expected);
    return LedgerSql.execute(conn, sql, permanentThreshold, LedgerSql.errorText(error), at, id);
  }

  @Override
  public void appendHistory(Connection conn, String id, HistoryEntry entry) {
    String sql = "INSERT INTO " + historyTableName() +
        " (transaction_id, recorded_at, status, detail) VALUES (?,?,?,?)";
    LedgerSql.execute(conn, sql, id, entry.at(), entry.status(), entry.detail());
  }

  @Override
  public List<Transaction> findIncomplete(Connection conn, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status IN " + RECOVERABLE_STATUS_IN +
        " AND response IS NOT NULL AND recovery_data IS NOT NULL" +
        " ORDER BY created_at LIMIT ?";
    return LedgerSql.list(conn, sql, rowMapper, limit).stream()
        .map(tx -> tx.withHistory(loadHistory(conn, tx.id())))
        .collect(Collectors.toList());
  }

  @Override
  public Map<TransactionStatus, Long> countByStatus(Connection conn) {
    String sql = "SELECT status, COUNT(*) FROM " + tableName() + " GROUP BY status";
    Map<TransactionStatus, Long> counts = new EnumMap<>(TransactionStatus.class);
    List<Map.Entry<TransactionStatus, Long>> rows = LedgerSql.list(conn, sql,
        rs -> Map.entry(TransactionStatus.fromCode(rs.getInt(1)), rs.getLong(2)));
    for (Map.Entry<TransactionStatus, Long> row : rows) {
      counts.put(row.getKey(), row.getValue());
    }
    return counts;
  }

  protected List<HistoryEntry> loadHistory(Connection conn, String id) {
    String sql = "SELECT recorded_at, status, detail FROM " + historyTableName() +
        " WHERE transaction_id=? ORDER BY entry_id";
    return LedgerSql.list(conn, sql, rs -> new HistoryEntry(
        LedgerSql.instant(rs, "recorded_at"),
        TransactionStatus.fromCode(rs.getInt("status")),
        rs.getString("detail")), id);
  }

  private Transaction mapRow(ResultSet rs) throws SQLException {
    String kind = rs.getString("kind");
    return new Transaction(
        rs.getString("id"),
        rs.getString("submission_id"),
        rs.getString("conversation_id"),
        rs.getString("origin_id"),
        kind == null ? null : MediaKind.valueOf(kind),
        TransactionStatus.fromCode(rs.getInt("status")),
        rs.getInt("attempts"),
        decodeRecovery(rs.getString("recovery_data")),
        rs.getString("response"),
        rs.getString("last_error"),
        List.of(),
        LedgerSql.instant(rs, "created_at"),
        LedgerSql.instant(rs, "updated_at"));
  }

  private String encodeRecovery(RecoveryData recoveryData) {
    return recoveryData == null ? null : jsonCodec.encode(recoveryData.toMap());
  }

  private RecoveryData decodeRecovery(String json) {
    return json == null ? null : RecoveryData.fromMap(jsonCodec.decode(json));
  }

}
