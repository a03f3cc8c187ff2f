package mediaflow.stage;

import mediaflow.RecoveryData;
import mediaflow.ai.RemoteFile;
import mediaflow.dispatch.DeliveryTarget;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A job owned by exactly one stage queue. Each variant carries only the fields its stage
 * reads; moving to the next stage creates a new job.
 *
 * <p>{@link #attempt()} counts attempts within the current stage, starting at 0, and is
 * unrelated to the transaction's delivery attempts.
 */
public sealed interface StageJob
        permits StageJob.EntryJob, StageJob.UploadJob, StageJob.ProcessingCheckJob, StageJob.AnalysisJob {

    JobRoute route();

    MediaPayload media();

    int attempt();

    StageName stage();

    /**
     * Copy of this job with a different stage attempt.
     */
    StageJob withAttempt(int attempt);

    /**
     * The uploaded file, for jobs past the upload stage.
     */
    default Optional<RemoteFile> remoteFile() {
        return Optional.empty();
    }

    default DeliveryTarget target() {
        return new DeliveryTarget(route().transactionId(),
                new RecoveryData(route().conversationId(), route().originId(), media().contentRef()));
    }

    /**
     * One-line summary without content, for logs and the problem-jobs sink.
     */
    default String describe() {
        return stage().key() + " " + route().transactionId() + " attempt " + attempt()
                + " (" + media().kind() + ", " + media().mimeType() + ")";
    }

    record EntryJob(JobRoute route, MediaPayload media, int attempt) implements StageJob {
        public EntryJob {
            Objects.requireNonNull(route, "route");
            Objects.requireNonNull(media, "media");
        }

        @Override
        public StageName stage() {
            return StageName.ENTRY;
        }

        @Override
        public EntryJob withAttempt(int attempt) {
            return new EntryJob(route, media, attempt);
        }

        /**
         * The upload job this entry forwards to, with every field preserved.
         */
        public UploadJob toUpload() {
            return new UploadJob(route, media, 0);
        }
    }

    record UploadJob(JobRoute route, MediaPayload media, int attempt) implements StageJob {
        public UploadJob {
            Objects.requireNonNull(route, "route");
            Objects.requireNonNull(media, "media");
        }

        @Override
        public StageName stage() {
            return StageName.UPLOAD;
        }

        @Override
        public UploadJob withAttempt(int attempt) {
            return new UploadJob(route, media, attempt);
        }
    }

    /**
     * A poll of the uploaded file's processing state.
     *
     * @param file            the uploaded file
     * @param uploadedAt      when the upload finished; hard stops are measured from here
     * @param checks          status queries already made
     * @param lastProgressAt  when the last progress notice went out, or the upload time
     * @param slowNoticeSent  whether the one-time slow notice went out
     */
    record ProcessingCheckJob(JobRoute route, MediaPayload media, RemoteFile file, Instant uploadedAt,
                              int checks, Instant lastProgressAt, boolean slowNoticeSent, int attempt)
            implements StageJob {
        public ProcessingCheckJob {
            Objects.requireNonNull(route, "route");
            Objects.requireNonNull(media, "media");
            Objects.requireNonNull(file, "file");
            Objects.requireNonNull(uploadedAt, "uploadedAt");
            Objects.requireNonNull(lastProgressAt, "lastProgressAt");
        }

        /**
         * First check after an upload.
         */
        public static ProcessingCheckJob first(UploadJob upload, RemoteFile file, Instant uploadedAt) {
            return new ProcessingCheckJob(upload.route(), upload.media(), file, uploadedAt, 0, uploadedAt, false, 0);
        }

        @Override
        public StageName stage() {
            return StageName.PROCESSING_CHECK;
        }

        @Override
        public ProcessingCheckJob withAttempt(int attempt) {
            return new ProcessingCheckJob(route, media, file, uploadedAt, checks, lastProgressAt, slowNoticeSent,
                    attempt);
        }

        @Override
        public Optional<RemoteFile> remoteFile() {
            return Optional.of(file);
        }

        ProcessingCheckJob next(RemoteFile latest, Instant progressAt, boolean slowSent) {
            return new ProcessingCheckJob(route, media, latest, uploadedAt, checks + 1, progressAt, slowSent, attempt);
        }

        @Override
        public String describe() {
            return StageJob.super.describe() + " check " + checks;
        }
    }

    record AnalysisJob(JobRoute route, MediaPayload media, RemoteFile file, int attempt) implements StageJob {
        public AnalysisJob {
            Objects.requireNonNull(route, "route");
            Objects.requireNonNull(media, "media");
            Objects.requireNonNull(file, "file");
        }

        @Override
        public StageName stage() {
            return StageName.ANALYSIS;
        }

        @Override
        public AnalysisJob withAttempt(int attempt) {
            return new AnalysisJob(route, media, file, attempt);
        }

        @Override
        public Optional<RemoteFile> remoteFile() {
            return Optional.of(file);
        }
    }
}
