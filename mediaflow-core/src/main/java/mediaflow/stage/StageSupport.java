package mediaflow.stage;

import mediaflow.dispatch.Delivery;
import mediaflow.dispatch.ResultDispatcher;
import mediaflow.error.FailureKind;
import mediaflow.ledger.TransactionLedger;
import mediaflow.model.TransactionStatus;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Failure handling shared by the stage handlers.
 *
 * <p>Every failed attempt is recorded on the ledger first. A retryable failure is then
 * rescheduled while the job has attempts left and the ledger has not given up on the
 * transaction. Otherwise the failure is terminal: artifacts are cleaned up (or archived for
 * safety blocks) and the submitter gets exactly one failure notice.
 */
public final class StageSupport {
    private static final Logger logger = Logger.getLogger(StageSupport.class.getName());

    private final TransactionLedger ledger;
    private final ResultDispatcher dispatcher;
    private final ArtifactCleaner cleaner;

    public StageSupport(TransactionLedger ledger, ResultDispatcher dispatcher, ArtifactCleaner cleaner) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
    }

    public TransactionLedger ledger() {
        return ledger;
    }

    public ResultDispatcher dispatcher() {
        return dispatcher;
    }

    public ArtifactCleaner cleaner() {
        return cleaner;
    }

    /**
     * Records a failed attempt and retries or terminates the job.
     */
    public <J extends StageJob> StageResult fail(J job, StageContext<J> context, FailureKind kind, String detail) {
        Optional<TransactionStatus> status = ledger.recordFailure(job.route().transactionId(), kind, detail);
        boolean permanent = status.orElse(null) == TransactionStatus.FAILURE_PERMANENT;
        if (kind.isRetryable() && !permanent && context.hasAttemptsLeft(job)) {
            Duration delay = context.retryDelay(job);
            context.retry(job, delay);
            return new StageResult.Retry(kind, detail, delay);
        }
        return finish(job, kind, detail);
    }

    /**
     * Records a failure and terminates the job without retrying.
     */
    public StageResult terminate(StageJob job, FailureKind kind, String detail) {
        ledger.recordFailure(job.route().transactionId(), kind, detail);
        return finish(job, kind, detail);
    }

    private StageResult finish(StageJob job, FailureKind kind, String detail) {
        logger.log(Level.WARNING, "Job {0} failed terminally [{1}]: {2}",
                new Object[]{job.describe(), kind.code(), detail});
        if (kind.keepsArtifacts()) {
            cleaner.archiveBlocked(job, kind);
        } else {
            cleaner.cleanup(job);
        }
        dispatcher.deliver(job.target(), Delivery.failure(kind, job.media().kind()));
        return new StageResult.Failed(kind, detail);
    }
}
