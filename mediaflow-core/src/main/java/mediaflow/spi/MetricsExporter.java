package mediaflow.spi;

import mediaflow.SubmitResult;
import mediaflow.guard.CircuitState;
import mediaflow.stage.StageName;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Counts a submission by its outcome.
     */
    void incrementSubmission(SubmitResult result);

    /**
     * Counts a job that finished successfully in a stage.
     */
    void incrementStageCompleted(StageName stage);

    /**
     * Counts a job rescheduled after a retryable failure.
     */
    void incrementStageRetried(StageName stage);

    /**
     * Counts a job that ended in a stage with a terminal failure.
     */
    void incrementStageFailed(StageName stage);

    /**
     * Records the number of jobs waiting in a stage queue.
     */
    void recordStageDepth(StageName stage, int waiting);

    /**
     * Records how long a stage handler ran for one job.
     */
    default void recordStageDurationMs(StageName stage, long durationMs) {
    }

    /**
     * Counts a message accepted by the transport.
     */
    void incrementDelivered();

    /**
     * Counts a message written to the pending-notification store instead of being delivered.
     */
    void incrementDeliveryDeferred();

    /**
     * Counts a pending notification delivered by the recovery sweep.
     */
    default void incrementNotificationRecovered() {
    }

    /**
     * Counts a pending notification moved to the abandoned sink.
     */
    default void incrementNotificationAbandoned() {
    }

    /**
     * Counts a transition of the circuit breaker into {@code OPEN}.
     */
    void incrementCircuitOpened();

    /**
     * Records the circuit breaker state after a change.
     */
    default void recordCircuitState(CircuitState state) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSubmission(SubmitResult result) {
        }

        @Override
        public void incrementStageCompleted(StageName stage) {
        }

        @Override
        public void incrementStageRetried(StageName stage) {
        }

        @Override
        public void incrementStageFailed(StageName stage) {
        }

        @Override
        public void recordStageDepth(StageName stage, int waiting) {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementDeliveryDeferred() {
        }

        @Override
        public void incrementCircuitOpened() {
        }
    }
}
