package mediaflow.stage;

import mediaflow.ai.InferenceGateway;
import mediaflow.ai.RemoteFile;
import mediaflow.ai.RemoteFileState;
import mediaflow.error.FailureClassifier;
import mediaflow.error.FailureKind;
import mediaflow.error.InferenceException;
import mediaflow.error.UserMessages;
import mediaflow.stage.StageJob.AnalysisJob;
import mediaflow.stage.StageJob.ProcessingCheckJob;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls the uploaded file until the backend finished processing it.
 *
 * <p>Each check makes one status query and returns. While the file is processing, a
 * follow-up check is scheduled with exponential backoff; progress notices are sent at most
 * once per progress interval, plus one slow notice. A file reported {@code FAILED} fails
 * immediately. A file that stays in processing past the hard stops expires. A ready file
 * moves on to analysis.
 */
public final class ProcessingCheckStage implements StageHandler<ProcessingCheckJob> {
    private static final Logger logger = Logger.getLogger(ProcessingCheckStage.class.getName());

    private final InferenceGateway gateway;
    private final StageQueue<AnalysisJob> analyses;
    private final StageSupport support;
    private final ProcessingCheckPolicy policy;
    private final UserMessages messages;
    private final Clock clock;

    public ProcessingCheckStage(InferenceGateway gateway, StageQueue<AnalysisJob> analyses, StageSupport support,
                                ProcessingCheckPolicy policy, UserMessages messages, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.analyses = Objects.requireNonNull(analyses, "analyses");
        this.support = Objects.requireNonNull(support, "support");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public StageResult handle(ProcessingCheckJob job, StageContext<ProcessingCheckJob> context) {
        RemoteFile latest;
        try {
            latest = gateway.fileStatus(job.file().name());
        } catch (InferenceException e) {
            if (e.kind() == FailureKind.FILE_EXPIRED || e.kind() == FailureKind.FILE_FORBIDDEN) {
                return support.terminate(job, e.kind(), FailureClassifier.describe(e));
            }
            logger.log(Level.FINE, "Status query for " + job.describe() + " failed; checking again", e);
            latest = job.file();
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Status query for " + job.describe() + " failed; checking again", e);
            latest = job.file();
        }

        if (latest.state() == RemoteFileState.FAILED) {
            return support.terminate(job, FailureKind.PROCESSING_FAILED, "backend reported the file as failed");
        }
        if (latest.state().isReady()) {
            AnalysisJob analysis = new AnalysisJob(job.route(), job.media(), latest, 0);
            if (!analyses.enqueue(analysis)) {
                return support.fail(job, context, FailureKind.GENERAL, "analysis queue is full");
            }
            return StageResult.completed();
        }
        return waitForProcessing(job, latest, context);
    }

    private StageResult waitForProcessing(ProcessingCheckJob job, RemoteFile latest,
                                          StageContext<ProcessingCheckJob> context) {
        Instant now = clock.instant();
        int checks = job.checks() + 1;
        Optional<String> expiry = policy.expiryReason(checks, Duration.between(job.uploadedAt(), now));
        if (expiry.isPresent()) {
            return support.terminate(job, FailureKind.FILE_EXPIRED, expiry.get());
        }

        Instant progressAt = job.lastProgressAt();
        boolean slowSent = job.slowNoticeSent();
        if (!slowSent && policy.slowNoticeDue(checks)) {
            support.dispatcher().notify(job.target(), messages.takingLonger(job.media().kind()));
            slowSent = true;
            progressAt = now;
        } else if (policy.progressDue(Duration.between(progressAt, now))) {
            support.dispatcher().notify(job.target(), messages.stillProcessing(job.media().kind()));
            progressAt = now;
        }

        Duration delay = policy.delayFor(job.checks());
        context.reschedule(job.next(latest, progressAt, slowSent), delay);
        return new StageResult.Deferred(delay);
    }
}
