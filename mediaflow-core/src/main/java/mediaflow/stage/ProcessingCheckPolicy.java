package mediaflow.stage;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Polling schedule and hard stops for the processing-check stage.
 *
 * <p>The delay before check {@code n + 1} is {@code min(maxDelay, baseDelay * 2^n)}. A file
 * still processing is treated as expired once {@code maxChecks} checks were made, or once
 * more than {@code maxElapsed} passed since the upload and at least
 * {@code minChecksForElapsed} checks were made. These thresholds are tuned against one
 * backend's behaviour; adjust them for others.
 *
 * <p>The slow notice must be reachable: {@code slowNoticeAt} has to come before
 * {@code maxChecks}, and on the undelayed schedule the check it names must not be past the
 * elapsed-time stop.
 *
 * <p>Create instances via {@link #builder()} or {@link #defaults()}.
 */
public final class ProcessingCheckPolicy {
    private final ExponentialBackoffRetryPolicy backoff;
    private final Duration progressInterval;
    private final int slowNoticeAt;
    private final Duration maxElapsed;
    private final int minChecksForElapsed;
    private final int maxChecks;

    private ProcessingCheckPolicy(Builder builder) {
        this.backoff = new ExponentialBackoffRetryPolicy(builder.baseDelay.toMillis(), builder.maxDelay.toMillis());
        this.progressInterval = Objects.requireNonNull(builder.progressInterval, "progressInterval");
        this.maxElapsed = Objects.requireNonNull(builder.maxElapsed, "maxElapsed");
        if (builder.slowNoticeAt <= 0) {
            throw new IllegalArgumentException("slowNoticeAt must be > 0");
        }
        if (builder.minChecksForElapsed < 0) {
            throw new IllegalArgumentException("minChecksForElapsed must be >= 0");
        }
        if (builder.maxChecks <= 0) {
            throw new IllegalArgumentException("maxChecks must be > 0");
        }
        this.slowNoticeAt = builder.slowNoticeAt;
        this.minChecksForElapsed = builder.minChecksForElapsed;
        this.maxChecks = builder.maxChecks;
        if (slowNoticeAt >= maxChecks) {
            throw new IllegalArgumentException("slowNoticeAt must be < maxChecks");
        }
        if (slowNoticeAt >= minChecksForElapsed && scheduledElapsedAt(slowNoticeAt).compareTo(maxElapsed) > 0) {
            throw new IllegalArgumentException("slowNoticeAt " + slowNoticeAt + " falls after the "
                    + maxElapsed.toSeconds() + "s elapsed-time stop");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ProcessingCheckPolicy defaults() {
        return builder().build();
    }

    /**
     * Delay before the next check, after {@code checks} checks were made.
     */
    public Duration delayFor(int checks) {
        return Duration.ofMillis(backoff.computeDelayMs(checks));
    }

    /**
     * Time since upload at which check {@code checks} runs when every delay is honoured exactly
     * and the first check runs right after the upload.
     */
    public Duration scheduledElapsedAt(int checks) {
        Duration elapsed = Duration.ZERO;
        for (int n = 0; n < checks - 1; n++) {
            elapsed = elapsed.plus(delayFor(n));
        }
        return elapsed;
    }

    /**
     * Why a file still processing after {@code checks} checks and {@code elapsed} time
     * since upload counts as expired.
     *
     * @return the reason, or empty while polling may continue
     */
    public Optional<String> expiryReason(int checks, Duration elapsed) {
        if (checks >= maxChecks) {
            return Optional.of("still processing after " + checks + " status checks");
        }
        if (elapsed.compareTo(maxElapsed) > 0 && checks >= minChecksForElapsed) {
            return Optional.of("still processing " + elapsed.toSeconds() + "s after upload");
        }
        return Optional.empty();
    }

    /**
     * Whether a progress notice is due, given the time since the last one.
     */
    public boolean progressDue(Duration sinceLastNotice) {
        return sinceLastNotice.compareTo(progressInterval) >= 0;
    }

    public boolean slowNoticeDue(int checks) {
        return checks >= slowNoticeAt;
    }

    public Duration progressInterval() {
        return progressInterval;
    }

    public int maxChecks() {
        return maxChecks;
    }

    public Duration maxElapsed() {
        return maxElapsed;
    }

    /** Builder for {@link ProcessingCheckPolicy}. */
    public static final class Builder {
        private Duration baseDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(30);
        private Duration progressInterval = Duration.ofSeconds(20);
        private int slowNoticeAt = 5;
        private Duration maxElapsed = Duration.ofSeconds(120);
        private int minChecksForElapsed = 3;
        private int maxChecks = 12;

        private Builder() {
        }

        /**
         * <p>Optional. Defaults to {@code 2s}. Must be positive.
         */
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 30s}.
         */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        /**
         * Sets the minimum time between two progress notices.
         *
         * <p>Optional. Defaults to {@code 20s}.
         */
        public Builder progressInterval(Duration progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        /**
         * Sets the check count at which the one-time slow notice is sent.
         *
         * <p>Optional. Defaults to {@code 5}, about 30s after the upload.
         */
        public Builder slowNoticeAt(int slowNoticeAt) {
            this.slowNoticeAt = slowNoticeAt;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 120s}.
         */
        public Builder maxElapsed(Duration maxElapsed) {
            this.maxElapsed = maxElapsed;
            return this;
        }

        /**
         * Sets how many checks must have been made before the elapsed-time stop applies.
         *
         * <p>Optional. Defaults to {@code 3}.
         */
        public Builder minChecksForElapsed(int minChecksForElapsed) {
            this.minChecksForElapsed = minChecksForElapsed;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 12}.
         */
        public Builder maxChecks(int maxChecks) {
            this.maxChecks = maxChecks;
            return this;
        }

        public ProcessingCheckPolicy build() {
            return new ProcessingCheckPolicy(this);
        }
    }
}
