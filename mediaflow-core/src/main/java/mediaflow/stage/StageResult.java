package mediaflow.stage;

import mediaflow.error.FailureKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of handling one job, used by the queue for accounting.
 */
public sealed interface StageResult
        permits StageResult.Completed, StageResult.Deferred, StageResult.Retry, StageResult.Failed {

    static Completed completed() {
        return Completed.INSTANCE;
    }

    /**
     * The job finished and its successor, if any, was handed to the next stage.
     */
    final class Completed implements StageResult {
        private static final Completed INSTANCE = new Completed();

        private Completed() {
        }

        @Override
        public String toString() {
            return "Completed";
        }
    }

    /**
     * The remote work is not finished; a follow-up job was scheduled after {@code delay}.
     */
    record Deferred(Duration delay) implements StageResult {
        public Deferred {
            Objects.requireNonNull(delay, "delay");
        }
    }

    /**
     * The attempt failed and the job was rescheduled with its attempt incremented.
     */
    record Retry(FailureKind kind, String detail, Duration delay) implements StageResult {
        public Retry {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(delay, "delay");
        }
    }

    /**
     * Terminal failure. The submitter has been notified.
     */
    record Failed(FailureKind kind, String detail) implements StageResult {
        public Failed {
            Objects.requireNonNull(kind, "kind");
        }
    }
}
