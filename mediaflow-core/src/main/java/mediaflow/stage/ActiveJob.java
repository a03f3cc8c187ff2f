package mediaflow.stage;

import java.time.Duration;
import java.time.Instant;

/**
 * A job currently held by a worker.
 */
public record ActiveJob(StageName stage, String transactionId, Instant startedAt) {

    public Duration runningFor(Instant now) {
        return Duration.between(startedAt, now);
    }
}
