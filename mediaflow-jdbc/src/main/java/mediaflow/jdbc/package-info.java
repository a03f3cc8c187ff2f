/**
 * JDBC persistence for the transaction ledger and pending notifications.
 *
 * <p>{@link mediaflow.jdbc.store.JdbcTransactionStores} picks a dialect from the JDBC URL.
 * DDL for each supported database ships under {@code schema/}.
 */
package mediaflow.jdbc;
