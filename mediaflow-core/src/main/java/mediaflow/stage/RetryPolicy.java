package mediaflow.stage;

/**
 * Strategy for computing the delay before the next attempt of a job.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds after a given number of previous attempts.
     *
     * @param attempt zero-based attempt number
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);
}
