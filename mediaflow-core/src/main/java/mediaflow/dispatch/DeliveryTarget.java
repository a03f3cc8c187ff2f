package mediaflow.dispatch;

import mediaflow.RecoveryData;
import mediaflow.model.Transaction;

import java.util.Objects;

/**
 * Where a message for a transaction goes.
 *
 * @param transactionId the ledger record the message answers
 * @param recoveryData  destination and quote reference
 */
public record DeliveryTarget(String transactionId, RecoveryData recoveryData) {
    public DeliveryTarget {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(recoveryData, "recoveryData");
    }

    /**
     * Target for replaying a stored transaction.
     *
     * @throws IllegalArgumentException if the transaction has no recovery data
     */
    public static DeliveryTarget of(Transaction transaction) {
        if (transaction.recoveryData() == null) {
            throw new IllegalArgumentException("Transaction " + transaction.id() + " has no recovery data");
        }
        return new DeliveryTarget(transaction.id(), transaction.recoveryData());
    }

    public String destination() {
        return recoveryData.destination();
    }

    public String quotedMessageId() {
        return recoveryData.originId();
    }
}
