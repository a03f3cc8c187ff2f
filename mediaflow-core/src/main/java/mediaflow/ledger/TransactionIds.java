package mediaflow.ledger;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Generates transaction ids of the form {@code tx_<ULID>}.
 *
 * <p>Monotonic ULIDs sort lexicographically by creation time, also within one millisecond.
 */
public final class TransactionIds {
    public static final String PREFIX = "tx_";

    private TransactionIds() {
    }

    public static String next() {
        return PREFIX + UlidCreator.getMonotonicUlid();
    }
}
