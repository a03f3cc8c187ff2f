package mediaflow.dispatch;

import com.github.f4b6a3.ulid.UlidCreator;
import mediaflow.error.FailureClassifier;
import mediaflow.error.TransportException;
import mediaflow.error.UserMessages;
import mediaflow.ledger.TransactionLedger;
import mediaflow.model.DeliveryStatus;
import mediaflow.model.PendingNotification;
import mediaflow.model.Transaction;
import mediaflow.spi.ConnectionProvider;
import mediaflow.spi.MetricsExporter;
import mediaflow.spi.NotificationStore;
import mediaflow.spi.Transport;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single boundary between the pipeline and the transport.
 *
 * <p>{@link #deliver} tries a direct send, then the reply form quoting the inbound message.
 * When both fail it counts a delivery failure on the ledger, writes a pending-notification
 * record for the {@link NotificationRecoverySweeper} and returns {@code false}. It never
 * throws for transport or store failures.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class ResultDispatcher {
    private static final Logger logger = Logger.getLogger(ResultDispatcher.class.getName());

    private final Transport transport;
    private final TransactionLedger ledger;
    private final ConnectionProvider connectionProvider;
    private final NotificationStore notificationStore;
    private final UserMessages messages;
    private final MetricsExporter metrics;
    private final Clock clock;

    private ResultDispatcher(Builder builder) {
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.notificationStore = Objects.requireNonNull(builder.notificationStore, "notificationStore");
        this.messages = Objects.requireNonNull(builder.messages, "messages");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Delivers a response or a terminal failure message for a transaction.
     *
     * @param target   destination of the message
     * @param delivery the response text or failure classification
     * @return {@code true} if the transport accepted the message
     */
    public boolean deliver(DeliveryTarget target, Delivery delivery) {
        String text;
        String detail;
        if (delivery instanceof Delivery.Response response) {
            ledger.attachResponse(target.transactionId(), response.text());
            text = response.text();
            detail = "Response delivered";
        } else if (delivery instanceof Delivery.Failure failure) {
            text = messages.failure(failure.kind(), failure.media());
            detail = "Failure notice delivered [" + failure.kind().code() + "]";
        } else {
            throw new IllegalArgumentException("Unsupported delivery: " + delivery);
        }
        return send(target, text, detail);
    }

    /**
     * Delivers the stored response of a recovered transaction.
     *
     * @param transaction a transaction with a response and recovery data
     * @return {@code true} if the transport accepted the message
     */
    public boolean redeliver(Transaction transaction) {
        if (!transaction.isResumable()) {
            throw new IllegalArgumentException("Transaction " + transaction.id() + " cannot be replayed");
        }
        return send(DeliveryTarget.of(transaction), transaction.response(), "Response delivered by recovery");
    }

    /**
     * Sends an informational message that does not affect the ledger, such as a
     * progress notice. Failures are logged and dropped.
     *
     * @return {@code true} if the transport accepted the message
     */
    public boolean notify(DeliveryTarget target, String text) {
        TransportException failure = DeliveryAttempt.send(transport, target.destination(), null, text);
        if (failure != null) {
            logger.log(Level.FINE, "Notice for " + target.transactionId() + " not delivered", failure);
            return false;
        }
        return true;
    }

    /**
     * Whether a pending-notification record already owns redelivery for a transaction.
     */
    public boolean hasPendingNotification(String transactionId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return notificationStore.hasPending(conn, transactionId);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to look up pending notifications for " + transactionId, e);
            return false;
        }
    }

    private boolean send(DeliveryTarget target, String text, String detail) {
        TransportException failure = DeliveryAttempt.send(
                transport, target.destination(), target.quotedMessageId(), text);
        if (failure == null) {
            ledger.markDelivered(target.transactionId(), detail);
            metrics.incrementDelivered();
            return true;
        }
        String error = FailureClassifier.describe(failure);
        logger.log(Level.WARNING, "Delivery of " + target.transactionId() + " failed; saving pending notification",
                failure);
        ledger.recordDeliveryFailure(target.transactionId(), error);
        savePending(target, text, error);
        metrics.incrementDeliveryDeferred();
        return false;
    }

    private void savePending(DeliveryTarget target, String text, String error) {
        PendingNotification notification = new PendingNotification(
                "ntf_" + UlidCreator.getMonotonicUlid(),
                target.transactionId(),
                target.destination(),
                text,
                target.quotedMessageId(),
                target.recoveryData(),
                0,
                clock.instant(),
                null,
                DeliveryStatus.PENDING,
                error);
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            notificationStore.insert(conn, notification);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to save pending notification for " + target.transactionId(), e);
        }
    }

    /** Builder for {@link ResultDispatcher}. */
    public static final class Builder {
        private Transport transport;
        private TransactionLedger ledger;
        private ConnectionProvider connectionProvider;
        private NotificationStore notificationStore;
        private UserMessages messages;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder ledger(TransactionLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        /**
         * Sets the connection provider used to write pending notifications.
         *
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder notificationStore(NotificationStore notificationStore) {
            this.notificationStore = notificationStore;
            return this;
        }

        /**
         * Sets the texts used for failure notices.
         *
         * <p><b>Required.</b>
         */
        public Builder messages(UserMessages messages) {
            this.messages = messages;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * <p>Optional. Defaults to the system UTC clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ResultDispatcher build() {
            return new ResultDispatcher(this);
        }
    }
}
