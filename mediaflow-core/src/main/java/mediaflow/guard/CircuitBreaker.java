package mediaflow.guard;

import mediaflow.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Guards calls into the inference backend.
 *
 * <p>The breaker opens after {@code failureLimit} consecutive failures. While open it rejects
 * calls until more than {@code resetWindow} has passed since the last failure; it then lets
 * exactly one trial call through ({@link CircuitState#HALF_OPEN}). A successful trial closes
 * the breaker, a failed one reopens it and restarts the window. Concurrent callers asking
 * while the trial is in flight are rejected.
 *
 * <p>A single instance is shared by every stage. All methods are thread-safe.
 */
public final class CircuitBreaker {
    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    private final int failureLimit;
    private final Duration resetWindow;
    private final Clock clock;
    private final MetricsExporter metrics;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;

    private CircuitBreaker(Builder builder) {
        if (builder.failureLimit <= 0) {
            throw new IllegalArgumentException("failureLimit must be > 0");
        }
        Objects.requireNonNull(builder.resetWindow, "resetWindow");
        if (builder.resetWindow.isNegative()) {
            throw new IllegalArgumentException("resetWindow must be >= 0");
        }
        this.failureLimit = builder.failureLimit;
        this.resetWindow = builder.resetWindow;
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Asks for permission to call the backend. A {@code true} answer in half-open state
     * reserves the single trial call; the caller must report its outcome.
     *
     * @return whether the call may proceed
     */
    public synchronized boolean canExecute() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (Duration.between(lastFailureTime, clock.instant()).compareTo(resetWindow) > 0) {
                    changeState(CircuitState.HALF_OPEN);
                    trialInFlight = true;
                    return true;
                }
                return false;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    /**
     * Resets the failure count and closes the breaker.
     */
    public synchronized void recordSuccess() {
        failureCount = 0;
        trialInFlight = false;
        if (state != CircuitState.CLOSED) {
            changeState(CircuitState.CLOSED);
        }
    }

    /**
     * Records a backend failure.
     *
     * @return {@code true} if this failure opened the breaker
     */
    public synchronized boolean recordFailure() {
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            open();
            return true;
        }
        failureCount++;
        if (state == CircuitState.CLOSED && failureCount >= failureLimit) {
            open();
            return true;
        }
        return false;
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized int failureCount() {
        return failureCount;
    }

    private void open() {
        changeState(CircuitState.OPEN);
        metrics.incrementCircuitOpened();
        logger.log(Level.WARNING, "Circuit opened after {0} failures; rejecting calls for {1}",
                new Object[]{failureCount, resetWindow});
    }

    private void changeState(CircuitState next) {
        state = next;
        metrics.recordCircuitState(next);
        logger.log(Level.FINE, "Circuit state changed to {0}", next);
    }

    /** Builder for {@link CircuitBreaker}. */
    public static final class Builder {
        private int failureLimit = 5;
        private Duration resetWindow = Duration.ofSeconds(60);
        private Clock clock = Clock.systemUTC();
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the number of consecutive failures that opens the breaker.
         *
         * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
         *
         * @param failureLimit failure threshold
         * @return this builder
         */
        public Builder failureLimit(int failureLimit) {
            this.failureLimit = failureLimit;
            return this;
        }

        /**
         * Sets how long the breaker stays open after the last failure.
         *
         * <p>Optional. Defaults to {@code 60s}.
         *
         * @param resetWindow the cool-down window
         * @return this builder
         */
        public Builder resetWindow(Duration resetWindow) {
            this.resetWindow = resetWindow;
            return this;
        }

        /**
         * Sets the clock used to measure the reset window.
         *
         * <p>Optional. Defaults to the system UTC clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the metrics exporter notified of state changes.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(this);
        }
    }
}
