package mediaflow.jdbc.store;

import mediaflow.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of JDBC transaction stores with auto-detection from a JDBC URL.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/mediaflow.jdbc.store.AbstractJdbcTransactionStore}.
 *
 * <pre>{@code
 * AbstractJdbcTransactionStore store = JdbcTransactionStores.detect(dataSource);
 * AbstractJdbcTransactionStore pg = JdbcTransactionStores.get("postgresql");
 * }</pre>
 */
public final class JdbcTransactionStores {

  private static final List<AbstractJdbcTransactionStore> STORES;
  private static final Map<String, AbstractJdbcTransactionStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcTransactionStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();
    for (AbstractJdbcTransactionStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcTransactionStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcTransactionStore> all() {
    return STORES;
  }

  /**
   * Gets a store by dialect name.
   *
   * @param name dialect name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcTransactionStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcTransactionStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown transaction store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Detects the store from the URL of a connection borrowed from {@code dataSource}.
   *
   * @throws IllegalStateException if the connection cannot be obtained
   */
  public static AbstractJdbcTransactionStore detect(DataSource dataSource) {
    return detect(jdbcUrl(dataSource));
  }

  /**
   * Detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcTransactionStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcTransactionStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No transaction store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Detects the store for {@code dataSource} and configures it with {@code jsonCodec}.
   */
  public static AbstractJdbcTransactionStore detect(DataSource dataSource, JsonCodec jsonCodec) {
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    return detect(dataSource).withJsonCodec(jsonCodec);
  }

  /**
   * Returns the URL reported by a connection borrowed from {@code dataSource}.
   */
  public static String jdbcUrl(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      return conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read JDBC URL from DataSource", e);
    }
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
