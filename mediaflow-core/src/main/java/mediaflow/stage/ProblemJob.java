package mediaflow.stage;

import mediaflow.error.FailureKind;

import java.time.Instant;

/**
 * A failed job kept for inspection. Holds the job summary, never the content.
 *
 * @param stage         where the job failed
 * @param transactionId the ledger record
 * @param attempt       stage attempt that failed
 * @param kind          failure classification
 * @param detail        failure detail
 * @param job           {@link StageJob#describe()} of the failed job
 * @param failedAt      when the failure was recorded
 */
public record ProblemJob(StageName stage, String transactionId, int attempt, FailureKind kind, String detail,
                         String job, Instant failedAt) {

    static ProblemJob of(StageJob job, FailureKind kind, String detail, Instant failedAt) {
        return new ProblemJob(job.stage(), job.route().transactionId(), job.attempt(), kind, detail,
                job.describe(), failedAt);
    }
}
