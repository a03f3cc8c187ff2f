package mediaflow.dispatch;

import mediaflow.error.FailureClassifier;
import mediaflow.error.TransportException;
import mediaflow.ledger.TransactionLedger;
import mediaflow.model.PendingNotification;
import mediaflow.spi.ConnectionProvider;
import mediaflow.spi.MetricsExporter;
import mediaflow.spi.NotificationStore;
import mediaflow.spi.Transport;
import mediaflow.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled sweep that retries pending notifications written by the {@link ResultDispatcher}.
 *
 * <p>Each cycle reads pending records older than the skip-recent grace period, oldest first.
 * A record is deleted only after the transport accepted its content, and its transaction is
 * then marked delivered. A failed retry increments the record's counter; once the counter
 * reaches {@code maxAttempts} the record is moved to the abandoned sink.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized.
 *
 * @see AbandonedNotificationManager
 */
public final class NotificationRecoverySweeper implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(NotificationRecoverySweeper.class.getName());

    private final ConnectionProvider connectionProvider;
    private final NotificationStore notificationStore;
    private final Transport transport;
    private final TransactionLedger ledger;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Duration skipRecent;
    private final int batchSize;
    private final int maxAttempts;
    private final long intervalMs;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> sweepTask;
    private volatile boolean closed;

    private NotificationRecoverySweeper(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.notificationStore = Objects.requireNonNull(builder.notificationStore, "notificationStore");
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.ledger = Objects.requireNonNull(builder.ledger, "ledger");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.skipRecent != null && builder.skipRecent.isNegative()) {
            throw new IllegalArgumentException("skipRecent must be >= 0");
        }

        this.skipRecent = builder.skipRecent != null ? builder.skipRecent : Duration.ofSeconds(5);
        this.batchSize = builder.batchSize;
        this.maxAttempts = builder.maxAttempts;
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled sweep. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("NotificationRecoverySweeper has been closed");
        }
        if (sweepTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mediaflow-notify-"));
        sweepTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single sweep. Called by the scheduler; may be invoked directly.
     *
     * @return the number of notifications delivered in this cycle
     */
    public int runOnce() {
        if (closed) {
            return 0;
        }
        int delivered = 0;
        try {
            List<PendingNotification> pending = fetchPending(clock.instant().minus(skipRecent));
            for (PendingNotification notification : pending) {
                if (retry(notification)) {
                    delivered++;
                }
            }
            if (delivered > 0) {
                logger.log(Level.INFO, "Recovered {0} of {1} pending notifications",
                        new Object[]{delivered, pending.size()});
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Notification sweep failed", t);
        }
        return delivered;
    }

    private List<PendingNotification> fetchPending(Instant createdBefore) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return notificationStore.pollPending(conn, createdBefore, batchSize);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to fetch pending notifications", e);
            return List.of();
        }
    }

    private boolean retry(PendingNotification notification) {
        TransportException failure = DeliveryAttempt.send(transport, notification.destination(),
                notification.quotedMessageId(), notification.content());
        if (failure == null) {
            withConnection(notification.id(), conn -> notificationStore.delete(conn, notification.id()));
            if (notification.transactionId() != null) {
                ledger.markDelivered(notification.transactionId(), "Delivered by notification recovery");
            }
            metrics.incrementNotificationRecovered();
            return true;
        }

        String error = FailureClassifier.describe(failure);
        int attempts = notification.attempts() + 1;
        if (attempts >= maxAttempts) {
            logger.log(Level.WARNING, "Abandoning notification {0} for {1} after {2} attempts: {3}",
                    new Object[]{notification.id(), notification.destination(), attempts, error});
            withConnection(notification.id(),
                    conn -> notificationStore.markAbandoned(conn, notification.id(), clock.instant(), error));
            metrics.incrementNotificationAbandoned();
        } else {
            withConnection(notification.id(),
                    conn -> notificationStore.markAttempt(conn, notification.id(), clock.instant(), error));
        }
        return false;
    }

    private void withConnection(String notificationId, SqlAction action) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            action.apply(conn);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to update notification " + notificationId, e);
        }
    }

    /**
     * Cancels the sweep schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @FunctionalInterface
    private interface SqlAction {
        int apply(Connection conn) throws SQLException;
    }

    /**
     * Builder for {@link NotificationRecoverySweeper}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private NotificationStore notificationStore;
        private Transport transport;
        private TransactionLedger ledger;
        private MetricsExporter metrics;
        private Clock clock;
        private Duration skipRecent;
        private int batchSize = 50;
        private int maxAttempts = 5;
        private long intervalMs = 30_000;

        private Builder() {
        }

        /**
         * Sets the connection provider for reading and updating pending notifications.
         *
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
         * <p><b>Required.</b>
         *
         * @param notificationStore the persistence backend
         * @return this builder
         */
        public Builder notificationStore(NotificationStore notificationStore) {
            this.notificationStore = notificationStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param transport the chat transport
         * @return this builder
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Sets the ledger whose transactions are marked delivered after a successful retry.
         *
         * <p><b>Required.</b>
         *
         * @param ledger the transaction ledger
         * @return this builder
         */
        public Builder ledger(TransactionLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        /**
         * Sets a grace period during which freshly written records are not retried.
         *
         * <p>Optional. Defaults to {@code 5s}. Must be &ge; 0.
         *
         * @param skipRecent the grace period
         * @return this builder
         */
        public Builder skipRecent(Duration skipRecent) {
            this.skipRecent = skipRecent;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param batchSize max records per sweep
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the number of failed attempts after which a record is abandoned.
         *
         * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
         *
         * @param maxAttempts attempt ceiling
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
         *
         * @param intervalMs delay between sweeps in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * <p>Optional. Defaults to the system UTC clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public NotificationRecoverySweeper build() {
            return new NotificationRecoverySweeper(this);
        }
    }
}
