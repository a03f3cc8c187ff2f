package mediaflow.jdbc;

/**
 * Unchecked wrapper for {@link java.sql.SQLException}s raised by the JDBC stores.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
