package mediaflow.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of transactions per status.
 */
public record LedgerStatistics(Map<TransactionStatus, Long> byStatus) {

    public LedgerStatistics {
        EnumMap<TransactionStatus, Long> copy = new EnumMap<>(TransactionStatus.class);
        for (TransactionStatus status : TransactionStatus.values()) {
            copy.put(status, byStatus.getOrDefault(status, 0L));
        }
        byStatus = Collections.unmodifiableMap(copy);
    }

    public long total() {
        long total = 0;
        for (long count : byStatus.values()) {
            total += count;
        }
        return total;
    }

    public long count(TransactionStatus status) {
        return byStatus.get(status);
    }

    /**
     * Percentage of transactions that reached {@code DELIVERED}.
     *
     * @return a value between 0 and 100, or 0 when the ledger is empty
     */
    public double successRate() {
        long total = total();
        return total == 0 ? 0.0 : count(TransactionStatus.DELIVERED) * 100.0 / total;
    }
}
