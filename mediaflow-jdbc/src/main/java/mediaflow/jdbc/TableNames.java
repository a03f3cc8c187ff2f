package mediaflow.jdbc;

import java.util.Objects;

/**
 * Default table names and the identifier check applied to custom ones.
 *
 * <p>Names are concatenated into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_TRANSACTION_TABLE = "media_transaction";
  public static final String DEFAULT_HISTORY_TABLE = "transaction_history";
  public static final String DEFAULT_NOTIFICATION_TABLE = "pending_notification";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
