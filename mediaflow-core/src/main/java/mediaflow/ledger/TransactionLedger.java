package mediaflow.ledger;

import mediaflow.RecoveryData;
import mediaflow.Submission;
import mediaflow.error.FailureKind;
import mediaflow.model.HistoryEntry;
import mediaflow.model.LedgerStatistics;
import mediaflow.model.Transaction;
import mediaflow.model.TransactionStatus;
import mediaflow.spi.ConnectionProvider;
import mediaflow.spi.TransactionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Domain operations over the {@link TransactionStore}.
 *
 * <p>Each mutating operation runs in its own database transaction: one guarded update plus
 * one appended history entry. An operation whose target is missing, or whose current status
 * does not allow the change, is a logged no-op and returns {@code false} or empty. Store
 * failures inside these operations are logged at {@code SEVERE} and reported the same way;
 * only {@link #create(Submission)} throws.
 *
 * <p>A transaction reaches {@code FAILURE_PERMANENT} once its failure counter reaches the
 * permanent-failure threshold (3 by default) and never leaves it.
 */
public final class TransactionLedger {
    private static final Logger logger = Logger.getLogger(TransactionLedger.class.getName());

    public static final int DEFAULT_PERMANENT_FAILURE_THRESHOLD = 3;
    private static final int DEFAULT_INCOMPLETE_LIMIT = 500;
    private static final Set<TransactionStatus> NON_TERMINAL = EnumSet.of(
            TransactionStatus.CREATED, TransactionStatus.PROCESSING, TransactionStatus.RESPONSE_GENERATED,
            TransactionStatus.FAILURE_TEMPORARY, TransactionStatus.RECOVERY_IN_PROGRESS);
    private static final Set<TransactionStatus> RESPONSE_SOURCES = EnumSet.of(
            TransactionStatus.CREATED, TransactionStatus.PROCESSING);

    private final ConnectionProvider connectionProvider;
    private final TransactionStore store;
    private final Clock clock;
    private final int permanentFailureThreshold;

    public TransactionLedger(ConnectionProvider connectionProvider, TransactionStore store) {
        this(connectionProvider, store, Clock.systemUTC(), DEFAULT_PERMANENT_FAILURE_THRESHOLD);
    }

    public TransactionLedger(ConnectionProvider connectionProvider, TransactionStore store,
                             Clock clock, int permanentFailureThreshold) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (permanentFailureThreshold <= 0) {
            throw new IllegalArgumentException("permanentFailureThreshold must be > 0");
        }
        this.permanentFailureThreshold = permanentFailureThreshold;
    }

    /**
     * Records a new transaction in {@code CREATED} status.
     *
     * @param submission the accepted inbound event
     * @return the stored transaction
     * @throws LedgerException if the store is unreachable
     */
    public Transaction create(Submission submission) {
        Instant now = clock.instant();
        String id = TransactionIds.next();
        Transaction transaction = new Transaction(
                id,
                submission.submissionId(),
                submission.conversationId(),
                submission.originId(),
                submission.kind(),
                TransactionStatus.CREATED,
                0,
                null,
                null,
                null,
                List.of(new HistoryEntry(now, TransactionStatus.CREATED,
                        "Created for submission " + submission.submissionId())),
                now,
                now);
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                store.insert(conn, transaction);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            throw new LedgerException("Failed to create transaction for submission "
                    + submission.submissionId(), e);
        }
        return transaction;
    }

    public boolean markProcessing(String id) {
        return transition(id, TransactionStatus.PROCESSING, "Processing started");
    }

    /**
     * Flags a transaction picked up by startup recovery.
     */
    public boolean markRecoveryInProgress(String id) {
        return transition(id, TransactionStatus.RECOVERY_IN_PROGRESS, "Recovery started after restart");
    }

    public boolean markDelivered(String id) {
        return markDelivered(id, "Delivered to user");
    }

    public boolean markDelivered(String id, String detail) {
        return transition(id, TransactionStatus.DELIVERED, detail);
    }

    /**
     * Stores the generated response. A response is stored at most once; a transaction that
     * already failed temporarily keeps that status until it is delivered.
     *
     * @param id       the transaction id
     * @param response the generated text
     * @return {@code true} if the response was stored
     */
    public boolean attachResponse(String id, String response) {
        Objects.requireNonNull(response, "response");
        return mutate(id, "attachResponse", (conn, now) -> {
            TransactionStatus result = TransactionStatus.RESPONSE_GENERATED;
            int updated = store.setResponse(conn, id, response, RESPONSE_SOURCES, result, now);
            if (updated == 0) {
                result = TransactionStatus.FAILURE_TEMPORARY;
                updated = store.setResponse(conn, id, response,
                        EnumSet.of(TransactionStatus.FAILURE_TEMPORARY), result, now);
            }
            if (updated == 0) {
                return null;
            }
            store.appendHistory(conn, id, new HistoryEntry(now, result,
                    "Response generated (" + response.length() + " chars)"));
            return result;
        }).isPresent();
    }

    public boolean attachRecoveryData(String id, RecoveryData recoveryData) {
        Objects.requireNonNull(recoveryData, "recoveryData");
        return mutate(id, "attachRecoveryData", (conn, now) -> {
            if (store.setRecoveryData(conn, id, recoveryData, NON_TERMINAL, now) == 0) {
                return null;
            }
            TransactionStatus current = currentStatus(conn, id);
            store.appendHistory(conn, id, new HistoryEntry(now, current,
                    "Recovery data attached for " + recoveryData.destination()));
            return current;
        }).isPresent();
    }

    /**
     * Counts a failed delivery. The transaction moves to {@code FAILURE_TEMPORARY}, or to
     * {@code FAILURE_PERMANENT} once the counter reaches the threshold.
     *
     * @param id        the transaction id
     * @param errorText description of the failure
     * @return the resulting status, or empty if nothing changed
     */
    public Optional<TransactionStatus> recordDeliveryFailure(String id, String errorText) {
        return recordAttemptFailure(id, errorText, "Delivery failed: " + errorText);
    }

    /**
     * Counts a classified stage failure through the same accounting as delivery failures.
     *
     * @param id     the transaction id
     * @param kind   the classification
     * @param detail description of the failure
     * @return the resulting status, or empty if nothing changed
     */
    public Optional<TransactionStatus> recordFailure(String id, FailureKind kind, String detail) {
        String error = kind.code() + ": " + detail;
        return recordAttemptFailure(id, error, "Stage failed [" + kind.code() + "]: " + detail);
    }

    private Optional<TransactionStatus> recordAttemptFailure(String id, String error, String historyDetail) {
        return mutate(id, "recordFailure", (conn, now) -> {
            Set<TransactionStatus> sources = TransactionStatus.sourcesOf(TransactionStatus.FAILURE_TEMPORARY);
            if (store.recordFailure(conn, id, error, permanentFailureThreshold, sources, now) == 0) {
                return null;
            }
            Transaction updated = store.find(conn, id).orElseThrow();
            store.appendHistory(conn, id, new HistoryEntry(now, updated.status(),
                    historyDetail + " (attempt " + updated.attempts() + ")"));
            if (updated.status() == TransactionStatus.FAILURE_PERMANENT) {
                logger.log(Level.WARNING, "Transaction {0} failed permanently after {1} attempts",
                        new Object[]{id, updated.attempts()});
            }
            return updated.status();
        });
    }

    public Optional<Transaction> find(String id) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return store.find(conn, id);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load transaction " + id, e);
            return Optional.empty();
        }
    }

    /**
     * Returns transactions that can be resumed from stored data alone.
     *
     * @return transactions in {@code PROCESSING}, {@code RESPONSE_GENERATED} or
     *     {@code FAILURE_TEMPORARY} that carry both a response and recovery data
     */
    public List<Transaction> findIncomplete() {
        return findIncomplete(DEFAULT_INCOMPLETE_LIMIT);
    }

    public List<Transaction> findIncomplete(int limit) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return store.findIncomplete(conn, limit);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to query incomplete transactions", e);
            return List.of();
        }
    }

    public LedgerStatistics statistics() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return new LedgerStatistics(store.countByStatus(conn));
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to compute ledger statistics", e);
            return new LedgerStatistics(Map.of());
        }
    }

    public int permanentFailureThreshold() {
        return permanentFailureThreshold;
    }

    private boolean transition(String id, TransactionStatus next, String detail) {
        return mutate(id, "transition to " + next, (conn, now) -> {
            if (store.updateStatus(conn, id, TransactionStatus.sourcesOf(next), next, now) == 0) {
                return null;
            }
            store.appendHistory(conn, id, new HistoryEntry(now, next, detail));
            return next;
        }).isPresent();
    }

    private TransactionStatus currentStatus(Connection conn, String id) {
        return store.find(conn, id).map(Transaction::status).orElseThrow();
    }

    private Optional<TransactionStatus> mutate(String id, String operation, Mutation mutation) {
        Objects.requireNonNull(id, "id");
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                TransactionStatus result = mutation.apply(conn, clock.instant());
                if (result == null) {
                    conn.rollback();
                    logNoOp(conn, id, operation);
                    return Optional.empty();
                }
                conn.commit();
                return Optional.of(result);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Ledger operation " + operation + " failed for " + id, e);
            return Optional.empty();
        }
    }

    private void logNoOp(Connection conn, String id, String operation) {
        Optional<Transaction> existing = store.find(conn, id);
        if (existing.isEmpty()) {
            logger.log(Level.WARNING, "Transaction {0} not found; {1} ignored", new Object[]{id, operation});
        } else {
            logger.log(Level.FINE, "Transaction {0} is {1}; {2} ignored",
                    new Object[]{id, existing.get().status(), operation});
        }
    }

    @FunctionalInterface
    private interface Mutation {
        TransactionStatus apply(Connection conn, Instant now) throws SQLException;
    }
}
