package mediaflow.stage;

import mediaflow.error.FailureClassifier;
import mediaflow.error.FailureKind;
import mediaflow.spi.MetricsExporter;
import mediaflow.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A named worker pool draining a bounded queue of jobs of one kind.
 *
 * <p>Workers start when the queue is built. Each job is held by one worker at a time.
 * Delayed jobs (retries and status polls) wait on a scheduler thread and join the queue
 * when due, so waiting never occupies a worker. A due job that finds the queue full is
 * tried again one second later.
 *
 * <p>Create instances via {@link #builder(StageName, StageHandler)}. This class is
 * thread-safe; {@link #close()} stops accepting jobs and drains the queue within the
 * configured timeout.
 *
 * @param <J> the job variant of this stage
 */
public final class StageQueue<J extends StageJob> implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StageQueue.class.getName());

    private static final long QUEUE_POLL_TIMEOUT_MS = 50;
    private static final long FULL_QUEUE_RETRY_MS = 1000;
    private static final int RETAINED_COMPLETED = 100;

    private final StageName stage;
    private final StageHandler<J> handler;
    private final JobOptions options;
    private final ProblemJobSink problemJobs;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final long drainTimeoutMs;

    private final BlockingQueue<J> queue;
    private final ExecutorService workers;
    private final ScheduledExecutorService delayer;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final Map<Long, ActiveJob> active = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicInteger delayed = new AtomicInteger();
    private final Deque<J> retainedCompleted = new ArrayDeque<>();
    private final Context context = new Context();

    private StageQueue(Builder<J> builder) {
        this.stage = Objects.requireNonNull(builder.stage, "stage");
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        this.options = builder.options != null ? builder.options : JobOptions.defaults();
        this.problemJobs = builder.problemJobs != null ? builder.problemJobs : new InMemoryProblemJobSink();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.drainTimeoutMs = builder.drainTimeoutMs;

        if (builder.workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0");
        }
        if (builder.capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.queue = new ArrayBlockingQueue<>(builder.capacity);
        this.delayer = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("mediaflow-" + stage.key() + "-delay-"));

        DaemonThreadFactory factory = new DaemonThreadFactory("mediaflow-" + stage.key() + "-");
        if (builder.workerCount > 0) {
            this.workers = Executors.newFixedThreadPool(builder.workerCount, factory);
            for (int i = 0; i < builder.workerCount; i++) {
                workers.submit(this::workerLoop);
            }
        } else {
            // workerCount=0: jobs stay queued until drained by hand
            logger.log(Level.WARNING, "workerCount=0 for stage {0}: jobs will not be processed", stage.key());
            this.workers = Executors.newCachedThreadPool(factory);
        }
    }

    /**
     * Creates a builder for a stage queue.
     *
     * @param stage   the stage this queue serves
     * @param handler the work done per job
     * @param <J>     the job variant
     * @return a new builder
     */
    public static <J extends StageJob> Builder<J> builder(StageName stage, StageHandler<J> handler) {
        return new Builder<>(stage, handler);
    }

    public StageName stage() {
        return stage;
    }

    /**
     * Offers a job for immediate processing.
     *
     * @param job the job
     * @return {@code false} if the queue is full or closed
     */
    public boolean enqueue(J job) {
        Objects.requireNonNull(job, "job");
        if (!accepting.get()) {
            return false;
        }
        boolean enqueued = queue.offer(job);
        metrics.recordStageDepth(stage, queue.size());
        return enqueued;
    }

    /**
     * Schedules a job to join the queue after {@code delay}.
     *
     * @param job   the job
     * @param delay how long to wait
     * @return {@code false} if the queue is closed
     */
    public boolean enqueueDelayed(J job, Duration delay) {
        Objects.requireNonNull(job, "job");
        if (!accepting.get()) {
            return false;
        }
        return schedule(job, Math.max(0L, delay.toMillis()));
    }

    private boolean schedule(J job, long delayMs) {
        delayed.incrementAndGet();
        try {
            delayer.schedule(() -> release(job), delayMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            delayed.decrementAndGet();
            logger.log(Level.WARNING, "Stage {0} closed; dropped delayed job {1}",
                    new Object[]{stage.key(), job.describe()});
            return false;
        }
    }

    private void release(J job) {
        delayed.decrementAndGet();
        if (queue.offer(job)) {
            metrics.recordStageDepth(stage, queue.size());
            return;
        }
        if (accepting.get()) {
            logger.log(Level.FINE, "Stage {0} full; delaying {1} again", new Object[]{stage.key(), job.describe()});
            schedule(job, FULL_QUEUE_RETRY_MS);
        } else {
            logger.log(Level.WARNING, "Stage {0} closed; dropped delayed job {1}",
                    new Object[]{stage.key(), job.describe()});
        }
    }

    /**
     * Handles the next queued job on the calling thread.
     *
     * @return {@code true} if a job was handled
     */
    public boolean processNext() {
        J job = queue.poll();
        if (job == null) {
            return false;
        }
        process(job);
        return true;
    }

    public StageCounts counts() {
        return new StageCounts(queue.size(), active.size(), completed.get(), failed.get(), delayed.get());
    }

    public List<ActiveJob> activeJobs() {
        return List.copyOf(active.values());
    }

    /**
     * Recently completed jobs, newest last. Empty unless {@link JobOptions#removeOnSuccess()}
     * is {@code false}.
     */
    public List<J> retainedCompleted() {
        synchronized (retainedCompleted) {
            return new ArrayList<>(retainedCompleted);
        }
    }

    public ProblemJobSink problemJobs() {
        return problemJobs;
    }

    private void workerLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                if (!running.get() && queue.isEmpty()) {
                    break;
                }
                J job = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (job == null) {
                    if (!running.get()) {
                        break;
                    }
                    continue;
                }
                process(job);
                metrics.recordStageDepth(stage, queue.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Stage " + stage.key() + " worker loop error", t);
            }
        }
    }

    private void process(J job) {
        long key = sequence.incrementAndGet();
        active.put(key, new ActiveJob(stage, job.route().transactionId(), clock.instant()));
        long startNanos = System.nanoTime();
        try {
            StageResult result = handler.handle(job, context);
            account(job, result);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unhandled failure in stage " + stage.key() + " for " + job.describe(), e);
            fail(job, new StageResult.Failed(FailureKind.GENERAL, FailureClassifier.describe(e)));
        } finally {
            active.remove(key);
            metrics.recordStageDurationMs(stage, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }
    }

    private void account(J job, StageResult result) {
        if (result instanceof StageResult.Completed) {
            completed.incrementAndGet();
            metrics.incrementStageCompleted(stage);
            if (!options.removeOnSuccess()) {
                retain(job);
            }
        } else if (result instanceof StageResult.Retry retry) {
            metrics.incrementStageRetried(stage);
            logger.log(Level.INFO, "Retrying {0} in {1} after {2}",
                    new Object[]{job.describe(), retry.delay(), retry.kind().code()});
        } else if (result instanceof StageResult.Failed failure) {
            fail(job, failure);
        } else if (result instanceof StageResult.Deferred deferred) {
            logger.log(Level.FINE, "Deferred {0} by {1}", new Object[]{job.describe(), deferred.delay()});
        }
    }

    private void fail(J job, StageResult.Failed failure) {
        failed.incrementAndGet();
        metrics.incrementStageFailed(stage);
        if (!options.removeOnFailure()) {
            problemJobs.record(ProblemJob.of(job, failure.kind(), failure.detail(), clock.instant()));
        }
    }

    private void retain(J job) {
        synchronized (retainedCompleted) {
            if (retainedCompleted.size() == RETAINED_COMPLETED) {
                retainedCompleted.removeFirst();
            }
            retainedCompleted.addLast(job);
        }
    }

    /**
     * Stops accepting jobs, drains queued jobs within the drain timeout, then shuts down
     * workers. Delayed jobs that have not become due are dropped.
     */
    @Override
    public void close() {
        accepting.set(false);
        running.set(false);
        int pending = delayed.get();
        delayer.shutdownNow();
        if (pending > 0) {
            logger.log(Level.WARNING, "Stage {0} closed with {1} delayed jobs", new Object[]{stage.key(), pending});
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Drain timeout exceeded for stage {0}; {1} jobs remaining",
                        new Object[]{stage.key(), queue.size()});
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private final class Context implements StageContext<J> {
        @Override
        public StageName stage() {
            return stage;
        }

        @Override
        public boolean hasAttemptsLeft(J job) {
            return job.attempt() + 1 < options.maxAttempts();
        }

        @Override
        public Duration retryDelay(J job) {
            return Duration.ofMillis(options.backoff().computeDelayMs(job.attempt()));
        }

        @Override
        public void reschedule(J job, Duration delay) {
            if (!enqueueDelayed(job, delay)) {
                logger.log(Level.WARNING, "Could not reschedule {0}; stage is closed", job.describe());
            }
        }

        @Override
        @SuppressWarnings("unchecked")
        public void retry(J job, Duration delay) {
            reschedule((J) job.withAttempt(job.attempt() + 1), delay);
        }
    }

    /**
     * Builder for {@link StageQueue}.
     *
     * @param <J> the job variant
     */
    public static final class Builder<J extends StageJob> {
        private final StageName stage;
        private final StageHandler<J> handler;
        private int workerCount = 3;
        private int capacity = 1000;
        private JobOptions options;
        private ProblemJobSink problemJobs;
        private MetricsExporter metrics;
        private Clock clock;
        private long drainTimeoutMs = 5000;

        private Builder(StageName stage, StageHandler<J> handler) {
            this.stage = stage;
            this.handler = handler;
        }

        /**
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0; {@code 0} starts no workers.
         *
         * @param workerCount number of worker threads
         * @return this builder
         */
        public Builder<J> workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
         *
         * @param capacity maximum queued jobs
         * @return this builder
         */
        public Builder<J> capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link JobOptions#defaults()}.
         *
         * @param options attempt and retention options
         * @return this builder
         */
        public Builder<J> options(JobOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets where terminally failed jobs are kept.
         *
         * <p>Optional. Defaults to a new {@link InMemoryProblemJobSink}.
         *
         * @param problemJobs the sink
         * @return this builder
         */
        public Builder<J> problemJobs(ProblemJobSink problemJobs) {
            this.problemJobs = problemJobs;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder<J> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * <p>Optional. Defaults to the system UTC clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder<J> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param drainTimeoutMs how long {@link StageQueue#close()} waits for queued jobs
         * @return this builder
         */
        public Builder<J> drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds the queue and starts its workers.
         *
         * @return a new queue
         */
        public StageQueue<J> build() {
            return new StageQueue<>(this);
        }
    }
}
