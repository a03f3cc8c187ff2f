/**
 * Persisted records of the pipeline: transactions with their append-only history and
 * pending notifications awaiting redelivery.
 *
 * @see mediaflow.model.Transaction
 * @see mediaflow.model.TransactionStatus
 * @see mediaflow.model.PendingNotification
 */
package mediaflow.model;
