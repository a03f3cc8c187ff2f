/**
 * The transaction ledger: the durable record that makes every submission answerable
 * exactly once, plus startup recovery of interrupted deliveries.
 */
package mediaflow.ledger;
