/**
 * Result delivery: the dispatcher, the pending-notification recovery sweep and the
 * abandoned-notification sink.
 */
package mediaflow.dispatch;
