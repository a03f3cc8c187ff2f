/**
 * Retention purgers for terminal transactions and abandoned notifications.
 */
package mediaflow.jdbc.purge;
