/**
 * Retention sweep for terminal transactions and abandoned notifications.
 */
package mediaflow.purge;
