package mediaflow.model;

import mediaflow.MediaKind;
import mediaflow.RecoveryData;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one ledger record, as read from the store.
 *
 * <p>Instances are never mutated; every ledger operation writes to the store and the
 * next read returns a new snapshot.
 */
public record Transaction(
        String id,
        String submissionId,
        String conversationId,
        String originId,
        MediaKind kind,
        TransactionStatus status,
        int attempts,
        RecoveryData recoveryData,
        String response,
        String lastError,
        List<HistoryEntry> history,
        Instant createdAt,
        Instant updatedAt
) {
    public Transaction {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Whether delivery can be replayed using only stored data.
     *
     * @return {@code true} if the status is resumable and both response and recovery data are present
     */
    public boolean isResumable() {
        return TransactionStatus.resumable().contains(status) && response != null && recoveryData != null;
    }

    public boolean isRecoverable() {
        return TransactionStatus.recoverable().contains(status) && response != null && recoveryData != null;
    }

    public Transaction withHistory(List<HistoryEntry> entries) {
        return new Transaction(id, submissionId, conversationId, originId, kind, status, attempts,
                recoveryData, response, lastError, entries, createdAt, updatedAt);
    }
}
