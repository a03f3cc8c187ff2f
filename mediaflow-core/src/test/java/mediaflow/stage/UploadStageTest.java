package mediaflow.stage;

import mediaflow.MediaKind;
import mediaflow.error.FailureKind;
import mediaflow.error.InferenceException;
import mediaflow.model.TransactionStatus;
import mediaflow.stage.StageJob.ProcessingCheckJob;
import mediaflow.stage.StageJob.UploadJob;
import mediaflow.stubs.RecordingStageContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UploadStageTest {

    @TempDir
    Path dir;

    private StageFixture fixture;
    private StageQueue<ProcessingCheckJob> checks;
    private UploadStage stage;
    private RecordingStageContext<UploadJob> context;
    private Path image;
    private JobRoute route;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new StageFixture();
        checks = StageQueue.<ProcessingCheckJob>builder(StageName.PROCESSING_CHECK,
                        (job, ctx) -> StageResult.completed())
                .workerCount(0)
                .capacity(1)
                .drainTimeoutMs(100)
                .build();
        stage = new UploadStage(fixture.gateway, checks, fixture.support, Duration.ofSeconds(5), fixture.clock);
        context = new RecordingStageContext<>(StageName.UPLOAD, 3, Duration.ofSeconds(30));
        image = StageFixture.content(dir, "photo.jpg");
        route = fixture.transaction(image, MediaKind.IMAGE, false);
    }

    @AfterEach
    void tearDown() {
        checks.close();
        fixture.close();
    }

    private UploadJob job(int attempt) {
        return new UploadJob(route, StageFixture.payload(image, MediaKind.IMAGE), attempt);
    }

    @Test
    void uploadStartsProcessingChecks() {
        StageResult result = stage.handle(job(0), context);

        assertEquals(StageResult.completed(), result);
        assertEquals(TransactionStatus.PROCESSING, fixture.status(route));
        assertEquals(1, checks.counts().waiting());
        assertEquals(1, fixture.client.uploads());
        assertTrue(Files.exists(image));
    }

    @Test
    void missingContentTerminates() throws IOException {
        Files.delete(image);

        StageResult result = stage.handle(job(0), context);

        assertEquals(FailureKind.GENERAL, ((StageResult.Failed) result).kind());
        assertEquals(0, fixture.client.uploads());
        assertEquals(1, fixture.transport.sent().size());
    }

    @Test
    void retryableFailureKeepsContentAndRetries() {
        fixture.client.failUpload(new InferenceException(FailureKind.QUOTA_EXCEEDED, "429"));

        StageResult result = stage.handle(job(0), context);

        StageResult.Retry retry = assertInstanceOf(StageResult.Retry.class, result);
        assertEquals(FailureKind.QUOTA_EXCEEDED, retry.kind());
        assertEquals(1, context.last().job().attempt());
        assertTrue(Files.exists(image));
        assertTrue(fixture.transport.sent().isEmpty());
        assertEquals(TransactionStatus.FAILURE_TEMPORARY, fixture.status(route));
    }

    @Test
    void retryDoesNotRestartProcessing() {
        fixture.client.failUpload(new InferenceException(FailureKind.QUOTA_EXCEEDED, "429"));
        stage.handle(job(0), context);

        assertEquals(StageResult.completed(), stage.handle(job(1), context));
        assertEquals(TransactionStatus.FAILURE_TEMPORARY, fixture.status(route));
    }

    @Test
    void lastAttemptFailsTerminally() {
        fixture.client.failUpload(new InferenceException(FailureKind.TIMEOUT, "slow"));

        StageResult result = stage.handle(job(2), context);

        assertEquals(FailureKind.TIMEOUT, ((StageResult.Failed) result).kind());
        assertTrue(context.scheduled().isEmpty());
        assertFalse(Files.exists(image));
    }

    @Test
    void contentFailureIsNotRetried() {
        fixture.client.failUpload(new InferenceException(FailureKind.FILE_TOO_LARGE, "413"));

        StageResult result = stage.handle(job(0), context);

        assertEquals(FailureKind.FILE_TOO_LARGE, ((StageResult.Failed) result).kind());
        assertEquals(fixture.messages.failure(FailureKind.FILE_TOO_LARGE, MediaKind.IMAGE),
                fixture.transport.sent().get(0).text());
        assertFalse(Files.exists(image));
    }

    @Test
    void openCircuitFailsFast() {
        for (int i = 0; i < 5; i++) {
            fixture.breaker.recordFailure();
        }

        StageResult result = stage.handle(job(0), context);

        assertEquals(FailureKind.SERVICE_UNAVAILABLE, ((StageResult.Failed) result).kind());
        assertEquals(0, fixture.client.uploads());
    }

    @Test
    void fullCheckQueueReleasesRemoteFile() {
        stage.handle(job(0), context);

        StageResult result = stage.handle(job(1), context);

        StageResult.Retry retry = assertInstanceOf(StageResult.Retry.class, result);
        assertEquals(FailureKind.GENERAL, retry.kind());
        assertEquals(List.of("files/2"), fixture.client.deleted());
        assertTrue(Files.exists(image));
    }
}
