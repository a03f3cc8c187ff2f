package mediaflow.stage;

import java.time.Duration;

/**
 * Queue operations available to a {@link StageHandler} while it handles a job.
 *
 * @param <J> the job variant of the queue
 */
public interface StageContext<J extends StageJob> {

    StageName stage();

    /**
     * Whether another attempt is allowed after the current one fails.
     */
    boolean hasAttemptsLeft(J job);

    /**
     * Backoff before the next attempt of {@code job}, from the queue's job options.
     */
    Duration retryDelay(J job);

    /**
     * Schedules {@code job} on this queue after {@code delay}. Backoff waits never
     * occupy a worker.
     */
    void reschedule(J job, Duration delay);

    /**
     * Schedules the next attempt of {@code job} after {@code delay}.
     */
    void retry(J job, Duration delay);
}
