/**
 * Dialect-specific transaction stores and the portable notification store.
 */
package mediaflow.jdbc.store;
