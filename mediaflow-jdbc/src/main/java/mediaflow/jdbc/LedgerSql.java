package mediaflow.jdbc;

import mediaflow.MediaKind;
import mediaflow.model.DeliveryStatus;
import mediaflow.model.TransactionStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Statement helpers for the ledger and notification tables.
 *
 * <p>Parameters are bound from ledger types: an {@link Instant} becomes a {@code TIMESTAMP},
 * {@link TransactionStatus} and {@link DeliveryStatus} become their integer codes and
 * {@link MediaKind} its name. Any other parameter type is rejected. Every {@link SQLException}
 * surfaces as a {@link StoreException} naming the statement kind.
 */
public final class LedgerSql {
  static final int MAX_ERROR_LENGTH = 4000;

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Runs an INSERT, UPDATE or DELETE and returns the affected row count. */
  public static int execute(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreException("Failed to execute " + kind(sql), e);
    }
  }

  public static <T> List<T> list(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params);
         ResultSet rs = ps.executeQuery()) {
      List<T> rows = new ArrayList<>();
      while (rs.next()) {
        rows.add(mapper.map(rs));
      }
      return rows;
    } catch (SQLException e) {
      throw new StoreException("Failed to execute " + kind(sql), e);
    }
  }

  /** First mapped row; empty when there is none or it maps to {@code null}. */
  public static <T> Optional<T> single(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = list(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  /** Reads a single numeric column such as {@code COUNT(*)}; 0 when no row comes back. */
  public static long count(Connection conn, String sql, Object... params) {
    return single(conn, sql, rs -> rs.getLong(1), params).orElse(0L);
  }

  /**
   * Renders transaction status codes as a sorted SQL list, e.g. {@code (1,2,4)}.
   */
  public static String codes(Collection<TransactionStatus> statuses) {
    if (statuses.isEmpty()) {
      throw new IllegalArgumentException("statuses must not be empty");
    }
    return statuses.stream()
        .map(TransactionStatus::code)
        .sorted()
        .map(String::valueOf)
        .collect(Collectors.joining(",", "(", ")"));
  }

  /** Caps stored error text at the column budget, marking the cut with {@code "..."}. */
  public static String errorText(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  /** Nullable timestamp column as an {@link Instant}. */
  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        bind(ps, i + 1, params[i]);
      }
      return ps;
    } catch (SQLException | RuntimeException e) {
      ps.close();
      throw e;
    }
  }

  private static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
    if (value == null) {
      ps.setObject(index, null);
    } else if (value instanceof String s) {
      ps.setString(index, s);
    } else if (value instanceof Integer n) {
      ps.setInt(index, n);
    } else if (value instanceof Long n) {
      ps.setLong(index, n);
    } else if (value instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else if (value instanceof TransactionStatus status) {
      ps.setInt(index, status.code());
    } else if (value instanceof DeliveryStatus status) {
      ps.setInt(index, status.code());
    } else if (value instanceof MediaKind kind) {
      ps.setString(index, kind.name());
    } else {
      throw new IllegalArgumentException("Unsupported parameter type at index " + index + ": "
          + value.getClass().getName());
    }
  }

  private static String kind(String sql) {
    String trimmed = sql.stripLeading();
    int space = trimmed.indexOf(' ');
    return (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
  }

  private LedgerSql() {}
}
