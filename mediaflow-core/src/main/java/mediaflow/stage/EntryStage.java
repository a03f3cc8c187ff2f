package mediaflow.stage;

import mediaflow.error.FailureKind;
import mediaflow.stage.StageJob.EntryJob;
import mediaflow.stage.StageJob.UploadJob;

import java.util.Objects;

/**
 * Forwards entry jobs to the upload queue unchanged.
 */
public final class EntryStage implements StageHandler<EntryJob> {
    private final StageQueue<UploadJob> uploads;
    private final StageSupport support;

    public EntryStage(StageQueue<UploadJob> uploads, StageSupport support) {
        this.uploads = Objects.requireNonNull(uploads, "uploads");
        this.support = Objects.requireNonNull(support, "support");
    }

    @Override
    public StageResult handle(EntryJob job, StageContext<EntryJob> context) {
        if (!uploads.enqueue(job.toUpload())) {
            return support.fail(job, context, FailureKind.GENERAL, "upload queue is full");
        }
        return StageResult.completed();
    }
}
