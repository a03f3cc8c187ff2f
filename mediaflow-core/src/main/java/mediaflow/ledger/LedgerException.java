package mediaflow.ledger;

/**
 * The ledger could not reach its store while creating a transaction.
 */
public final class LedgerException extends RuntimeException {
    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
