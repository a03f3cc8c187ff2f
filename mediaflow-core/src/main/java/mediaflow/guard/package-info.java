/**
 * Process-local guards shared by all stage workers: the circuit breaker protecting the
 * inference backend and the dedup cache filtering repeated inbound events.
 */
package mediaflow.guard;
