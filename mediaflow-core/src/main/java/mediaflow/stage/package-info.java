/**
 * The stage queues and their workers.
 *
 * <p>A submission moves {@code ENTRY -> UPLOAD -> PROCESSING_CHECK (repeated) -> ANALYSIS}.
 * Every stage owns its job until it enqueues the successor; failures are recorded on the
 * ledger and either retried with backoff or reported to the submitter through the
 * {@link mediaflow.dispatch.ResultDispatcher}.
 */
package mediaflow.stage;
