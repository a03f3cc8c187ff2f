package mediaflow.guard;

import mediaflow.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Time-bounded set of recently seen submission ids.
 *
 * <p>Entries older than the window count as absent even before the sweep removes them, so a
 * repeat after the window is treated as new. The cache is advisory: it only suppresses
 * redeliveries arriving in quick succession.
 *
 * <p>This class is thread-safe.
 */
public final class DedupCache implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DedupCache.class.getName());

    private final Map<String, Long> firstSeen = new ConcurrentHashMap<>();
    private final long windowMs;
    private final Duration sweepInterval;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> sweepTask;
    private volatile boolean closed;

    public DedupCache(Duration window, Duration sweepInterval, Clock clock) {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        this.windowMs = window.toMillis();
        this.sweepInterval = sweepInterval;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a cache with a 15 minute window swept every minute.
     */
    public DedupCache() {
        this(Duration.ofMinutes(15), Duration.ofMinutes(1), Clock.systemUTC());
    }

    public boolean seen(String submissionId) {
        Long at = firstSeen.get(submissionId);
        return at != null && !expired(at, clock.millis());
    }

    public void mark(String submissionId) {
        firstSeen.put(submissionId, clock.millis());
    }

    /**
     * Marks the id unless it was seen within the window. Atomic with respect to
     * concurrent callers for the same id.
     *
     * @param submissionId the inbound event id
     * @return {@code true} if this call marked the id, {@code false} if it is a duplicate
     */
    public boolean markIfAbsent(String submissionId) {
        long now = clock.millis();
        boolean[] marked = {false};
        firstSeen.compute(submissionId, (id, existing) -> {
            if (existing == null || expired(existing, now)) {
                marked[0] = true;
                return now;
            }
            return existing;
        });
        return marked[0];
    }

    /**
     * Drops an id so that a later submission with the same id is accepted again.
     */
    public void forget(String submissionId) {
        firstSeen.remove(submissionId);
    }

    /**
     * Removes entries older than the window.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, Long> entry : firstSeen.entrySet()) {
            if (expired(entry.getValue(), now) && firstSeen.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.log(Level.FINE, "Dedup sweep removed {0} entries", removed);
        }
        return removed;
    }

    public int size() {
        return firstSeen.size();
    }

    /**
     * Starts the periodic sweep. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DedupCache has been closed");
        }
        if (sweepTask != null) {
            return;
        }
        long intervalMs = sweepInterval.toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mediaflow-dedup-"));
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Dedup sweep failed", e);
        }
    }

    private boolean expired(long firstSeenAt, long now) {
        return now - firstSeenAt > windowMs;
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }
}
