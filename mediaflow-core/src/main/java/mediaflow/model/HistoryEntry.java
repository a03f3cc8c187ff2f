package mediaflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable line of a transaction's history.
 *
 * @param at     when the entry was written
 * @param status the transaction status after the operation
 * @param detail human-readable description of the operation
 */
public record HistoryEntry(Instant at, TransactionStatus status, String detail) {
    public HistoryEntry {
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(detail, "detail");
    }
}
