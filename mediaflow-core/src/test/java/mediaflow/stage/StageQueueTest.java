package mediaflow.stage;

import mediaflow.DescriptionMode;
import mediaflow.MediaKind;
import mediaflow.error.FailureKind;
import mediaflow.stage.StageJob.EntryJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageQueueTest {

    private final List<StageQueue<?>> queues = new ArrayList<>();

    @AfterEach
    void tearDown() {
        queues.forEach(StageQueue::close);
    }

    private StageQueue<EntryJob> manual(StageHandler<EntryJob> handler, JobOptions options, int capacity) {
        StageQueue<EntryJob> queue = StageQueue.builder(StageName.ENTRY, handler)
                .workerCount(0)
                .capacity(capacity)
                .options(options)
                .drainTimeoutMs(200)
                .build();
        queues.add(queue);
        return queue;
    }

    private static EntryJob job(String id) {
        return new EntryJob(new JobRoute(id, "chat-1", "msg-1"),
                new MediaPayload(MediaKind.IMAGE, "/tmp/" + id + ".jpg", "image/jpeg", null, DescriptionMode.SHORT), 0);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met in time");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void completedJobsAreCounted() {
        StageQueue<EntryJob> queue = manual((job, ctx) -> StageResult.completed(), JobOptions.defaults(), 10);

        assertTrue(queue.enqueue(job("tx_1")));
        assertEquals(1, queue.counts().waiting());
        assertTrue(queue.processNext());
        assertFalse(queue.processNext());

        StageCounts counts = queue.counts();
        assertEquals(0, counts.waiting());
        assertEquals(1, counts.completed());
        assertTrue(queue.retainedCompleted().isEmpty());
    }

    @Test
    void completedJobsRetainedWhenConfigured() {
        JobOptions keep = new JobOptions(3, new ExponentialBackoffRetryPolicy(10, 100), false, false);
        StageQueue<EntryJob> queue = manual((job, ctx) -> StageResult.completed(), keep, 10);

        queue.enqueue(job("tx_1"));
        queue.processNext();

        assertEquals("tx_1", queue.retainedCompleted().get(0).route().transactionId());
    }

    @Test
    void failedJobsGoToProblemSink() {
        StageQueue<EntryJob> queue = manual(
                (job, ctx) -> new StageResult.Failed(FailureKind.FILE_TOO_LARGE, "too big"), JobOptions.defaults(), 10);

        queue.enqueue(job("tx_1"));
        queue.processNext();

        assertEquals(1, queue.counts().failed());
        ProblemJob problem = queue.problemJobs().recent(1).get(0);
        assertEquals(StageName.ENTRY, problem.stage());
        assertEquals("tx_1", problem.transactionId());
        assertEquals(FailureKind.FILE_TOO_LARGE, problem.kind());
    }

    @Test
    void failedJobsDroppedWhenConfigured() {
        JobOptions drop = JobOptions.defaults();
        drop = new JobOptions(drop.maxAttempts(), drop.backoff(), true, true);
        StageQueue<EntryJob> queue = manual(
                (job, ctx) -> new StageResult.Failed(FailureKind.GENERAL, "boom"), drop, 10);

        queue.enqueue(job("tx_1"));
        queue.processNext();

        assertEquals(1, queue.counts().failed());
        assertEquals(0, queue.problemJobs().count());
    }

    @Test
    void handlerExceptionBecomesGeneralFailure() {
        StageQueue<EntryJob> queue = manual((job, ctx) -> {
            throw new IllegalStateException("unexpected");
        }, JobOptions.defaults(), 10);

        queue.enqueue(job("tx_1"));
        queue.processNext();

        ProblemJob problem = queue.problemJobs().recent(1).get(0);
        assertEquals(FailureKind.GENERAL, problem.kind());
        assertTrue(problem.detail().contains("unexpected"));
    }

    @Test
    void fullQueueRejects() {
        StageQueue<EntryJob> queue = manual((job, ctx) -> StageResult.completed(), JobOptions.defaults(), 2);

        assertTrue(queue.enqueue(job("tx_1")));
        assertTrue(queue.enqueue(job("tx_2")));
        assertFalse(queue.enqueue(job("tx_3")));
    }

    @Test
    void closedQueueRejects() {
        StageQueue<EntryJob> queue = manual((job, ctx) -> StageResult.completed(), JobOptions.defaults(), 2);
        queue.close();

        assertFalse(queue.enqueue(job("tx_1")));
        assertFalse(queue.enqueueDelayed(job("tx_1"), Duration.ofMillis(1)));
    }

    @Test
    void retryRequeuesNextAttemptAfterDelay() throws InterruptedException {
        List<Integer> attempts = new CopyOnWriteArrayList<>();
        StageQueue<EntryJob> queue = manual((job, ctx) -> {
            attempts.add(job.attempt());
            if (ctx.hasAttemptsLeft(job)) {
                ctx.retry(job, Duration.ofMillis(20));
                return new StageResult.Retry(FailureKind.TIMEOUT, "slow", Duration.ofMillis(20));
            }
            return new StageResult.Failed(FailureKind.TIMEOUT, "slow");
        }, JobOptions.defaults().withMaxAttempts(2), 10);

        queue.enqueue(job("tx_1"));
        queue.processNext();
        await(() -> queue.counts().waiting() == 1);
        queue.processNext();

        assertEquals(List.of(0, 1), attempts);
        assertEquals(1, queue.counts().failed());
        assertEquals(0, queue.counts().delayed());
    }

    @Test
    void retryDelayFollowsBackoff() {
        List<Duration> delays = new CopyOnWriteArrayList<>();
        JobOptions options = JobOptions.defaults().withBackoff(new ExponentialBackoffRetryPolicy(100, 1000));
        StageQueue<EntryJob> queue = manual((job, ctx) -> {
            delays.add(ctx.retryDelay(job));
            return StageResult.completed();
        }, options, 10);

        queue.enqueue(job("tx_1").withAttempt(2));
        queue.processNext();

        assertEquals(List.of(Duration.ofMillis(400)), delays);
    }

    @Test
    void workersDrainQueue() throws InterruptedException {
        AtomicInteger handled = new AtomicInteger();
        StageQueue<EntryJob> queue = StageQueue.<EntryJob>builder(StageName.ENTRY, (job, ctx) -> {
            handled.incrementAndGet();
            return StageResult.completed();
        }).workerCount(2).build();
        queues.add(queue);

        for (int i = 0; i < 10; i++) {
            assertTrue(queue.enqueue(job("tx_" + i)));
        }

        await(() -> queue.counts().completed() == 10);
        assertEquals(10, handled.get());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> StageQueue.<EntryJob>builder(StageName.ENTRY,
                (job, ctx) -> StageResult.completed()).workerCount(-1).build());
        assertThrows(IllegalArgumentException.class, () -> StageQueue.<EntryJob>builder(StageName.ENTRY,
                (job, ctx) -> StageResult.completed()).workerCount(0).capacity(0).build());
        assertThrows(NullPointerException.class,
                () -> StageQueue.<EntryJob>builder(StageName.ENTRY, null).workerCount(0).build());
    }
}
