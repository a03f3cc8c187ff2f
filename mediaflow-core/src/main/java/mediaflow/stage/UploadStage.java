package mediaflow.stage;

import mediaflow.ai.InferenceGateway;
import mediaflow.ai.RemoteFile;
import mediaflow.error.FailureClassifier;
import mediaflow.error.FailureKind;
import mediaflow.error.InferenceException;
import mediaflow.stage.StageJob.ProcessingCheckJob;
import mediaflow.stage.StageJob.UploadJob;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Uploads local content to the backend and hands the remote file to the processing check.
 */
public final class UploadStage implements StageHandler<UploadJob> {
    private static final Logger logger = Logger.getLogger(UploadStage.class.getName());

    private final InferenceGateway gateway;
    private final StageQueue<ProcessingCheckJob> checks;
    private final StageSupport support;
    private final Duration timeout;
    private final Clock clock;

    public UploadStage(InferenceGateway gateway, StageQueue<ProcessingCheckJob> checks, StageSupport support,
                       Duration timeout, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.checks = Objects.requireNonNull(checks, "checks");
        this.support = Objects.requireNonNull(support, "support");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public StageResult handle(UploadJob job, StageContext<UploadJob> context) {
        String transactionId = job.route().transactionId();
        if (job.attempt() == 0) {
            support.ledger().markProcessing(transactionId);
        }
        Path path = Path.of(job.media().contentRef());
        if (!Files.isReadable(path)) {
            return support.terminate(job, FailureKind.GENERAL, "local content is missing");
        }

        RemoteFile file;
        try {
            file = gateway.upload(path, job.media().mimeType(), timeout);
        } catch (InferenceException e) {
            return support.fail(job, context, e.kind(), FailureClassifier.describe(e));
        } catch (RuntimeException e) {
            return support.fail(job, context, FailureKind.GENERAL, FailureClassifier.describe(e));
        }

        logger.log(Level.FINE, "Uploaded {0} as {1}", new Object[]{transactionId, file.name()});
        if (!checks.enqueue(ProcessingCheckJob.first(job, file, clock.instant()))) {
            gateway.deleteQuietly(file.name());
            return support.fail(job, context, FailureKind.GENERAL, "processing-check queue is full");
        }
        return StageResult.completed();
    }
}
