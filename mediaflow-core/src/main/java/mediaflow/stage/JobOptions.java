package mediaflow.stage;

import java.util.Objects;

/**
 * Options shared by every job of a stage queue.
 *
 * @param maxAttempts     attempts per job within the stage, including the first
 * @param backoff         delay before each retry
 * @param removeOnSuccess whether completed jobs are discarded instead of kept for inspection
 * @param removeOnFailure whether failed jobs are discarded instead of sent to the problem-jobs sink
 */
public record JobOptions(int maxAttempts, RetryPolicy backoff, boolean removeOnSuccess, boolean removeOnFailure) {
    public JobOptions {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(backoff, "backoff");
    }

    /**
     * Three attempts, exponential backoff from 30 seconds capped at 5 minutes, completed jobs
     * discarded, failed jobs kept.
     *
     * @return the default options
     */
    public static JobOptions defaults() {
        return new JobOptions(3, new ExponentialBackoffRetryPolicy(30_000, 300_000), true, false);
    }

    public JobOptions withMaxAttempts(int maxAttempts) {
        return new JobOptions(maxAttempts, backoff, removeOnSuccess, removeOnFailure);
    }

    public JobOptions withBackoff(RetryPolicy backoff) {
        return new JobOptions(maxAttempts, backoff, removeOnSuccess, removeOnFailure);
    }
}
