package mediaflow.purge;

import mediaflow.spi.ConnectionProvider;
import mediaflow.spi.RecordPurger;
import mediaflow.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic cleanup of the delivery ledger.
 *
 * <p>Two kinds of records age out independently: transactions in a terminal status, and
 * notifications that were abandoned after exhausting their retries. Each kind has its own
 * purger and retention window; abandoned notifications default to the transaction window.
 * Pending notifications and non-terminal transactions are never touched.
 *
 * <p>A cycle drains abandoned notifications first, then terminal transactions, each in
 * auto-committed batches of {@code batchSize} until a batch comes back short. A failure stops
 * only the kind it occurred in and is reported in the {@link PurgeReport}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetentionSweeper implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RetentionSweeper.class.getName());

    /** Kind of ledger record removed by a sweep. */
    public enum Target {
        TRANSACTIONS,
        NOTIFICATIONS
    }

    private final ConnectionProvider connectionProvider;
    private final RecordPurger transactionPurger;
    private final RecordPurger notificationPurger;
    private final Duration transactionRetention;
    private final Duration notificationRetention;
    private final int batchSize;
    private final long intervalSeconds;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> sweepTask;
    private volatile boolean closed;

    private RetentionSweeper(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        if (builder.transactionPurger == null && builder.notificationPurger == null) {
            throw new IllegalArgumentException("a transaction or notification purger is required");
        }
        requireNonNegative(builder.transactionRetention, "transactionRetention");
        requireNonNegative(builder.notificationRetention, "notificationRetention");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        this.transactionPurger = builder.transactionPurger;
        this.notificationPurger = builder.notificationPurger;
        this.transactionRetention = builder.transactionRetention != null
                ? builder.transactionRetention : Duration.ofDays(7);
        this.notificationRetention = builder.notificationRetention != null
                ? builder.notificationRetention : transactionRetention;
        this.batchSize = builder.batchSize;
        this.intervalSeconds = builder.intervalSeconds;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    private static void requireNonNegative(Duration value, String name) {
        if (value != null && value.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Schedules a sweep every {@code intervalSeconds}, the first one after one interval.
     * Calling it again while scheduled has no effect.
     *
     * @throws IllegalStateException if the sweeper was closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RetentionSweeper has been closed");
        }
        if (sweepTask == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mediaflow-retention-"));
            sweepTask = scheduler.scheduleWithFixedDelay(
                    this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        }
    }

    /**
     * Runs one cleanup cycle on the calling thread.
     *
     * @return what was removed, and which kinds failed; empty once closed
     */
    public PurgeReport runOnce() {
        if (closed) {
            return PurgeReport.EMPTY;
        }
        Instant now = clock.instant();
        Set<Target> failed = EnumSet.noneOf(Target.class);
        int notifications = drain(Target.NOTIFICATIONS, notificationPurger, now.minus(notificationRetention), failed);
        int transactions = drain(Target.TRANSACTIONS, transactionPurger, now.minus(transactionRetention), failed);
        PurgeReport report = new PurgeReport(transactions, notifications, failed);
        if (report.total() > 0) {
            logger.log(Level.INFO, "Retention sweep removed {0} transactions and {1} abandoned notifications",
                    new Object[]{transactions, notifications});
        }
        return report;
    }

    private int drain(Target target, RecordPurger purger, Instant cutoff, Set<Target> failed) {
        if (purger == null) {
            return 0;
        }
        int removed = 0;
        int batch;
        try {
            do {
                try (Connection conn = connectionProvider.getConnection()) {
                    conn.setAutoCommit(true);
                    batch = purger.purge(conn, cutoff, batchSize);
                }
                removed += batch;
            } while (batch >= batchSize && !closed);
        } catch (SQLException | RuntimeException e) {
            failed.add(target);
            logger.log(Level.WARNING, "Retention sweep of " + target.name().toLowerCase(Locale.ROOT)
                    + " older than " + cutoff + " stopped after " + removed + " rows", e);
        }
        return removed;
    }

    /** Cancels the schedule; a cycle already running finishes its current batch. */
    @Override
    public synchronized void close() {
        closed = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Outcome of one cleanup cycle.
     *
     * @param transactionsPurged  terminal transactions deleted, history included
     * @param notificationsPurged abandoned notifications deleted
     * @param failed              kinds whose cleanup stopped on an error
     */
    public record PurgeReport(int transactionsPurged, int notificationsPurged, Set<Target> failed) {
        static final PurgeReport EMPTY = new PurgeReport(0, 0, Set.of());

        public PurgeReport {
            failed = failed.isEmpty() ? Set.of() : Set.copyOf(failed);
        }

        public int total() {
            return transactionsPurged + notificationsPurged;
        }
    }

    /** Builder for {@link RetentionSweeper}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private RecordPurger transactionPurger;
        private RecordPurger notificationPurger;
        private Duration transactionRetention;
        private Duration notificationRetention;
        private int batchSize = 500;
        private long intervalSeconds = 3600;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Purger for terminal transactions. At least one of this and
         * {@link #notificationPurger(RecordPurger)} is required.
         *
         * @param purger the purger, or {@code null} to keep transactions
         * @return this builder
         */
        public Builder transactionPurger(RecordPurger purger) {
            this.transactionPurger = purger;
            return this;
        }

        /**
         * Purger for abandoned notifications.
         *
         * @param purger the purger, or {@code null} to keep abandoned notifications
         * @return this builder
         */
        public Builder notificationPurger(RecordPurger purger) {
            this.notificationPurger = purger;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 7 days}. Must be &ge; 0.
         *
         * @param retention how long terminal transactions are kept after their last update
         * @return this builder
         */
        public Builder transactionRetention(Duration retention) {
            this.transactionRetention = retention;
            return this;
        }

        /**
         * <p>Optional. Defaults to the transaction retention. Must be &ge; 0.
         *
         * @param retention how long abandoned notifications stay available for replay
         * @return this builder
         */
        public Builder notificationRetention(Duration retention) {
            this.notificationRetention = retention;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
         *
         * @param batchSize max rows deleted per statement
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 3600}. Must be &gt; 0.
         *
         * @param intervalSeconds seconds between cycles
         * @return this builder
         */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        /**
         * <p>Optional. Defaults to the system UTC clock.
         *
         * @param clock the clock cutoffs are computed from
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RetentionSweeper build() {
            return new RetentionSweeper(this);
        }
    }
}
