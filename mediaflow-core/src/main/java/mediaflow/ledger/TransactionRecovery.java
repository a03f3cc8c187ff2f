package mediaflow.ledger;

import mediaflow.dispatch.ResultDispatcher;
import mediaflow.model.Transaction;
import mediaflow.model.TransactionStatus;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replays delivery of transactions that were interrupted by a restart.
 *
 * <p>Each transaction returned by {@link TransactionLedger#findIncomplete()} is moved through
 * {@code RECOVERY_IN_PROGRESS} and {@code PROCESSING}, and its stored response is sent to the
 * stored destination. No inbound event is needed. Transactions that already own a pending
 * notification are left to the notification sweep.
 *
 * <p>A transaction still in {@code RECOVERY_IN_PROGRESS} was claimed by a pass that stopped
 * before finishing; it is resumed from that status without being claimed again.
 */
public final class TransactionRecovery {
    private static final Logger logger = Logger.getLogger(TransactionRecovery.class.getName());

    private final TransactionLedger ledger;
    private final ResultDispatcher dispatcher;

    public TransactionRecovery(TransactionLedger ledger, ResultDispatcher dispatcher) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Runs one recovery pass.
     *
     * @return counts of what the pass did
     */
    public RecoveryReport recover() {
        List<Transaction> incomplete = ledger.findIncomplete();
        int delivered = 0;
        int skipped = 0;
        int failed = 0;
        for (Transaction transaction : incomplete) {
            try {
                switch (recoverOne(transaction)) {
                    case DELIVERED -> delivered++;
                    case SKIPPED -> skipped++;
                    case FAILED -> failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                logger.log(Level.SEVERE, "Recovery of transaction " + transaction.id() + " failed", e);
            }
        }
        RecoveryReport report = new RecoveryReport(incomplete.size(), delivered, skipped, failed);
        if (report.found() > 0) {
            logger.log(Level.INFO, "Recovery pass: {0}", report);
        }
        return report;
    }

    private Outcome recoverOne(Transaction transaction) {
        String id = transaction.id();
        if (dispatcher.hasPendingNotification(id)) {
            logger.log(Level.FINE, "Transaction {0} has a pending notification; skipping", id);
            return Outcome.SKIPPED;
        }
        boolean interrupted = transaction.status() == TransactionStatus.RECOVERY_IN_PROGRESS;
        if (interrupted) {
            logger.log(Level.INFO, "Resuming interrupted recovery of transaction {0}", id);
        } else if (!ledger.markRecoveryInProgress(id)) {
            return Outcome.SKIPPED;
        }
        if (!ledger.markProcessing(id)) {
            return Outcome.SKIPPED;
        }
        Optional<Transaction> current = ledger.find(id);
        if (current.isEmpty() || !current.get().isResumable()) {
            logger.log(Level.WARNING, "Transaction {0} is no longer resumable", id);
            return Outcome.FAILED;
        }
        return dispatcher.redeliver(current.get()) ? Outcome.DELIVERED : Outcome.FAILED;
    }

    private enum Outcome {
        DELIVERED,
        SKIPPED,
        FAILED
    }

    /**
     * Result of one recovery pass.
     *
     * @param found     incomplete transactions returned by the ledger
     * @param delivered transactions whose response was delivered
     * @param skipped   transactions left to the notification sweep or changed concurrently
     * @param failed    transactions whose redelivery failed again
     */
    public record RecoveryReport(int found, int delivered, int skipped, int failed) {
    }
}
