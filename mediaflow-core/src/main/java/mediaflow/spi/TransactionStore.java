package mediaflow.spi;

import mediaflow.RecoveryData;
import mediaflow.model.HistoryEntry;
import mediaflow.model.Transaction;
import mediaflow.model.TransactionStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence backend for the transaction ledger.
 *
 * <p>All methods take an explicit connection; the ledger decides transaction boundaries.
 * Every conditional update is a single statement guarded by the expected source statuses, so
 * concurrent writers for the same id cannot move a record backwards. Methods returning
 * {@code int} report rows affected; zero means the record is missing or the guard did not match.
 *
 * @see mediaflow.ledger.TransactionLedger
 */
public interface TransactionStore {

    /**
     * Inserts a new transaction together with its initial history.
     *
     * @param conn        the connection
     * @param transaction the record to insert
     */
    void insert(Connection conn, Transaction transaction);

    /**
     * Loads a transaction and its history ordered oldest first.
     *
     * @param conn the connection
     * @param id   the transaction id
     * @return the snapshot, or empty if absent
     */
    Optional<Transaction> find(Connection conn, String id);

    /**
     * Moves a transaction to {@code next} if its current status is one of {@code expected}.
     */
    int updateStatus(Connection conn, String id, Set<TransactionStatus> expected,
                     TransactionStatus next, Instant at);

    /**
     * Stores the generated response if none is stored yet and the status is one of
     * {@code expected}, moving the record to {@code next}.
     */
    int setResponse(Connection conn, String id, String response, Set<TransactionStatus> expected,
                    TransactionStatus next, Instant at);

    /**
     * Replaces the recovery data of a transaction whose status is one of {@code expected}.
     */
    int setRecoveryData(Connection conn, String id, RecoveryData recoveryData,
                        Set<TransactionStatus> expected, Instant at);

    /**
     * Increments the attempt counter and records {@code error}. The status becomes
     * {@code FAILURE_PERMANENT} when the incremented counter reaches {@code permanentThreshold},
     * otherwise {@code FAILURE_TEMPORARY}.
     */
    int recordFailure(Connection conn, String id, String error, int permanentThreshold,
                      Set<TransactionStatus> expected, Instant at);

    /**
     * Appends one history entry. Existing entries are never modified.
     */
    void appendHistory(Connection conn, String id, HistoryEntry entry);

    /**
     * Returns transactions that can be resumed from stored data alone, oldest first.
     * Transactions left in {@code RECOVERY_IN_PROGRESS} by an interrupted recovery are included.
     *
     * @param conn  the connection
     * @param limit maximum rows
     * @return transactions in a {@link TransactionStatus#recoverable() recoverable} status that
     *         carry both a response and recovery data
     */
    List<Transaction> findIncomplete(Connection conn, int limit);

    /**
     * Counts transactions per status. Statuses without rows may be absent from the map.
     */
    Map<TransactionStatus, Long> countByStatus(Connection conn);
}
