package mediaflow;

import mediaflow.ai.InferenceGateway;
import mediaflow.ai.ModelCache;
import mediaflow.ai.PromptTemplates;
import mediaflow.dispatch.AbandonedNotificationManager;
import mediaflow.dispatch.Delivery;
import mediaflow.dispatch.DeliveryTarget;
import mediaflow.dispatch.NotificationRecoverySweeper;
import mediaflow.dispatch.ResultDispatcher;
import mediaflow.error.DefaultUserMessages;
import mediaflow.error.FailureKind;
import mediaflow.error.UserMessages;
import mediaflow.guard.CircuitBreaker;
import mediaflow.guard.DedupCache;
import mediaflow.ledger.TransactionLedger;
import mediaflow.ledger.TransactionRecovery;
import mediaflow.model.Transaction;
import mediaflow.purge.RetentionSweeper;
import mediaflow.spi.ConnectionProvider;
import mediaflow.spi.ConversationConfigSource;
import mediaflow.spi.GenerativeModel;
import mediaflow.spi.InferenceClient;
import mediaflow.spi.MetricsExporter;
import mediaflow.spi.NotificationStore;
import mediaflow.spi.RecordPurger;
import mediaflow.spi.TransactionStore;
import mediaflow.spi.Transport;
import mediaflow.stage.ActiveJob;
import mediaflow.stage.AnalysisPolicy;
import mediaflow.stage.AnalysisStage;
import mediaflow.stage.ArtifactCleaner;
import mediaflow.stage.EntryStage;
import mediaflow.stage.InMemoryProblemJobSink;
import mediaflow.stage.JobOptions;
import mediaflow.stage.JobRoute;
import mediaflow.stage.MediaPayload;
import mediaflow.stage.PipelineStatus;
import mediaflow.stage.ProblemJobSink;
import mediaflow.stage.ProcessingCheckPolicy;
import mediaflow.stage.ProcessingCheckStage;
import mediaflow.stage.StageCounts;
import mediaflow.stage.StageHandler;
import mediaflow.stage.StageJob;
import mediaflow.stage.StageJob.AnalysisJob;
import mediaflow.stage.StageJob.EntryJob;
import mediaflow.stage.StageJob.ProcessingCheckJob;
import mediaflow.stage.StageJob.UploadJob;
import mediaflow.stage.StageName;
import mediaflow.stage.StageQueue;
import mediaflow.stage.StageSupport;
import mediaflow.stage.UploadStage;
import mediaflow.util.JsonCodec;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point wiring the ledger, the four stage queues, the dispatcher and the
 * background sweepers into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (MediaPipeline pipeline = MediaPipeline.builder()
 *     .connectionProvider(connectionProvider)
 *     .transactionStore(transactionStore)
 *     .notificationStore(notificationStore)
 *     .inferenceClient(client)
 *     .transport(transport)
 *     .build()) {
 *   pipeline.start();
 *   pipeline.submit(submission);
 * }
 * }</pre>
 *
 * <p>Stage workers run from construction; {@link #start()} starts the sweepers and runs
 * startup recovery.
 */
public final class MediaPipeline implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(MediaPipeline.class.getName());

    private final TransactionLedger ledger;
    private final ResultDispatcher dispatcher;
    private final TransactionRecovery recovery;
    private final DedupCache dedup;
    private final InferenceGateway gateway;
    private final ConversationConfigSource configSource;
    private final UserMessages messages;
    private final MetricsExporter metrics;
    private final ProblemJobSink problemJobs;
    private final Clock clock;
    private final boolean recoverOnStart;

    private final StageQueue<EntryJob> entry;
    private final StageQueue<UploadJob> upload;
    private final StageQueue<ProcessingCheckJob> processingCheck;
    private final StageQueue<AnalysisJob> analysis;

    private final NotificationRecoverySweeper notificationSweeper;
    private final AbandonedNotificationManager abandonedNotifications;
    private final RetentionSweeper retentionSweeper;

    private boolean started;
    private boolean closed;

    private MediaPipeline(Builder builder) {
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.messages = builder.messages != null ? builder.messages : new DefaultUserMessages();
        this.configSource = builder.configSource != null
                ? builder.configSource : conversationId -> ConversationConfig.defaults();
        this.problemJobs = builder.problemJobs != null ? builder.problemJobs : new InMemoryProblemJobSink();
        this.recoverOnStart = builder.recoverOnStart;

        this.ledger = new TransactionLedger(builder.connectionProvider, builder.transactionStore, clock,
                builder.permanentFailureThreshold);
        this.dispatcher = ResultDispatcher.builder()
                .transport(builder.transport)
                .ledger(ledger)
                .connectionProvider(builder.connectionProvider)
                .notificationStore(builder.notificationStore)
                .messages(messages)
                .metrics(metrics)
                .clock(clock)
                .build();
        this.recovery = new TransactionRecovery(ledger, dispatcher);
        this.dedup = new DedupCache(builder.dedupWindow, builder.dedupSweepInterval, clock);

        CircuitBreaker breaker = CircuitBreaker.builder()
                .failureLimit(builder.breakerFailureLimit)
                .resetWindow(builder.breakerResetWindow)
                .clock(clock)
                .metrics(metrics)
                .build();
        this.gateway = new InferenceGateway(builder.inferenceClient, breaker,
                new ModelCache<GenerativeModel>(builder.modelCacheSize));

        JsonCodec codec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        StageSupport support = new StageSupport(ledger, dispatcher,
                new ArtifactCleaner(gateway, builder.auditDirectory, codec, clock));
        AnalysisPolicy analysisPolicy = builder.analysisPolicy != null
                ? builder.analysisPolicy : AnalysisPolicy.defaults();
        ProcessingCheckPolicy checkPolicy = builder.processingCheckPolicy != null
                ? builder.processingCheckPolicy : ProcessingCheckPolicy.defaults();
        PromptTemplates prompts = builder.promptTemplates != null
                ? builder.promptTemplates : PromptTemplates.defaults();

        List<AutoCloseable> built = new ArrayList<>();
        try {
            this.analysis = track(built, queue(builder, StageName.ANALYSIS,
                    new AnalysisStage(gateway, support, configSource, prompts, analysisPolicy, messages)));
            this.processingCheck = track(built, queue(builder, StageName.PROCESSING_CHECK,
                    new ProcessingCheckStage(gateway, analysis, support, checkPolicy, messages, clock)));
            this.upload = track(built, queue(builder, StageName.UPLOAD,
                    new UploadStage(gateway, processingCheck, support, analysisPolicy.uploadTimeout(), clock)));
            this.entry = track(built, queue(builder, StageName.ENTRY, new EntryStage(upload, support)));

            this.notificationSweeper = track(built, NotificationRecoverySweeper.builder()
                    .connectionProvider(builder.connectionProvider)
                    .notificationStore(builder.notificationStore)
                    .transport(builder.transport)
                    .ledger(ledger)
                    .metrics(metrics)
                    .clock(clock)
                    .batchSize(builder.notificationBatchSize)
                    .maxAttempts(builder.notificationMaxAttempts)
                    .intervalMs(builder.notificationIntervalMs)
                    .skipRecent(builder.notificationSkipRecent)
                    .build());
            this.abandonedNotifications = new AbandonedNotificationManager(
                    builder.connectionProvider, builder.notificationStore);

            if (builder.transactionPurger == null && builder.notificationPurger == null) {
                this.retentionSweeper = null;
            } else {
                this.retentionSweeper = track(built, RetentionSweeper.builder()
                        .connectionProvider(builder.connectionProvider)
                        .transactionPurger(builder.transactionPurger)
                        .notificationPurger(builder.notificationPurger)
                        .transactionRetention(builder.retention)
                        .notificationRetention(builder.notificationRetention)
                        .batchSize(builder.retentionBatchSize)
                        .intervalSeconds(builder.retentionIntervalSeconds)
                        .clock(clock)
                        .build());
            }
        } catch (RuntimeException e) {
            for (AutoCloseable closeable : built) {
                closeQuietly(closeable, e);
            }
            gateway.close();
            dedup.close();
            throw e;
        }
    }

    private static <T extends AutoCloseable> T track(List<AutoCloseable> built, T closeable) {
        built.add(closeable);
        return closeable;
    }

    private static void closeQuietly(AutoCloseable closeable, RuntimeException primary) {
        try {
            closeable.close();
        } catch (Exception e) {
            primary.addSuppressed(e);
        }
    }

    private <J extends StageJob> StageQueue<J> queue(Builder builder, StageName stage,
                                                           StageHandler<J> handler) {
        return StageQueue.builder(stage, handler)
                .workerCount(builder.workerCounts.getOrDefault(stage, builder.workerCount))
                .capacity(builder.queueCapacity)
                .options(builder.jobOptions != null ? builder.jobOptions : JobOptions.defaults())
                .problemJobs(problemJobs)
                .metrics(metrics)
                .clock(clock)
                .drainTimeoutMs(builder.drainTimeoutMs)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the dedup sweep, the notification and retention sweepers, then replays
     * interrupted deliveries if recovery on start is enabled. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("MediaPipeline has been closed");
        }
        if (started) {
            return;
        }
        started = true;
        dedup.start();
        notificationSweeper.start();
        if (retentionSweeper != null) {
            retentionSweeper.start();
        }
        if (recoverOnStart) {
            recoverIncomplete();
        }
        logger.log(Level.INFO, "Media pipeline started");
    }

    /**
     * Accepts an inbound event.
     *
     * <p>Non-media kinds are {@link SubmitResult#UNSUPPORTED}; kinds disabled for the
     * conversation are {@link SubmitResult#DISABLED}; an id seen within the dedup window is a
     * {@link SubmitResult#DUPLICATE}. Otherwise a transaction is created and an entry job
     * enqueued. When the entry queue is full the submitter is told the service is
     * overloaded and the result is {@link SubmitResult#REJECTED}.
     *
     * @param submission the inbound event
     * @return the outcome
     * @throws mediaflow.ledger.LedgerException if the transaction cannot be stored
     */
    public SubmitResult submit(Submission submission) {
        Objects.requireNonNull(submission, "submission");
        SubmitResult result = doSubmit(submission);
        metrics.incrementSubmission(result);
        return result;
    }

    private SubmitResult doSubmit(Submission submission) {
        if (!submission.kind().isPipelineMedia()) {
            return SubmitResult.UNSUPPORTED;
        }
        ConversationConfig config = configSource.configFor(submission.conversationId());
        if (!config.accepts(submission.kind())) {
            logger.log(Level.FINE, "{0} disabled for conversation {1}",
                    new Object[]{submission.kind(), submission.conversationId()});
            return SubmitResult.DISABLED;
        }
        if (!dedup.markIfAbsent(submission.submissionId())) {
            logger.log(Level.FINE, "Duplicate submission {0} ignored", submission.submissionId());
            return SubmitResult.DUPLICATE;
        }

        Transaction transaction;
        try {
            transaction = ledger.create(submission);
        } catch (RuntimeException e) {
            dedup.forget(submission.submissionId());
            throw e;
        }
        RecoveryData recoveryData = new RecoveryData(
                submission.conversationId(), submission.originId(), submission.contentRef());
        ledger.attachRecoveryData(transaction.id(), recoveryData);

        EntryJob job = new EntryJob(
                new JobRoute(transaction.id(), submission.conversationId(), submission.originId()),
                new MediaPayload(submission.kind(), submission.contentRef(), submission.mimeType(),
                        submission.text(), config.descriptionMode()),
                0);
        if (!entry.enqueue(job)) {
            logger.log(Level.WARNING, "Entry queue full; rejecting submission {0}", submission.submissionId());
            ledger.recordFailure(transaction.id(), FailureKind.SERVICE_UNAVAILABLE, "entry queue is full");
            dispatcher.deliver(new DeliveryTarget(transaction.id(), recoveryData),
                    Delivery.failure(FailureKind.SERVICE_UNAVAILABLE, submission.kind()));
            return SubmitResult.REJECTED;
        }
        return SubmitResult.ACCEPTED;
    }

    /**
     * Replays delivery of transactions interrupted by a restart.
     *
     * @return what the recovery pass did
     */
    public TransactionRecovery.RecoveryReport recoverIncomplete() {
        return recovery.recover();
    }

    /**
     * Read-only snapshot of queue counts, ledger statistics and long-running jobs.
     */
    public PipelineStatus status() {
        Instant now = clock.instant();
        Map<StageName, StageCounts> counts = new EnumMap<>(StageName.class);
        List<ActiveJob> longRunning = new ArrayList<>();
        for (StageQueue<?> queue : List.of(entry, upload, processingCheck, analysis)) {
            counts.put(queue.stage(), queue.counts());
            for (ActiveJob job : queue.activeJobs()) {
                if (job.runningFor(now).compareTo(PipelineStatus.LONG_RUNNING) > 0) {
                    longRunning.add(job);
                }
            }
        }
        return new PipelineStatus(counts, ledger.statistics(), longRunning, problemJobs.count(), now);
    }

    public TransactionLedger ledger() {
        return ledger;
    }

    public ResultDispatcher dispatcher() {
        return dispatcher;
    }

    public ProblemJobSink problemJobs() {
        return problemJobs;
    }

    public AbandonedNotificationManager abandonedNotifications() {
        return abandonedNotifications;
    }

    public NotificationRecoverySweeper notificationSweeper() {
        return notificationSweeper;
    }

    public InferenceGateway gateway() {
        return gateway;
    }

    /**
     * Shuts down in order: sweepers, then stage queues from entry to analysis so that
     * drained jobs can still reach later stages, then the gateway.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        RuntimeException first = null;
        List<AutoCloseable> order = new ArrayList<>();
        if (retentionSweeper != null) {
            order.add(retentionSweeper);
        }
        order.add(notificationSweeper);
        order.add(dedup);
        order.add(entry);
        order.add(upload);
        order.add(processingCheck);
        order.add(analysis);
        order.add(gateway);
        for (AutoCloseable closeable : order) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) {
                    first = re;
                } else {
                    first.addSuppressed(re);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /** Builder for {@link MediaPipeline}. Each builder can be used once. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private TransactionStore transactionStore;
        private NotificationStore notificationStore;
        private InferenceClient inferenceClient;
        private Transport transport;
        private ConversationConfigSource configSource;
        private UserMessages messages;
        private PromptTemplates promptTemplates;
        private MetricsExporter metrics;
        private JsonCodec jsonCodec;
        private Clock clock;
        private ProblemJobSink problemJobs;
        private int workerCount = 3;
        private final Map<StageName, Integer> workerCounts = new EnumMap<>(StageName.class);
        private int queueCapacity = 1000;
        private JobOptions jobOptions;
        private long drainTimeoutMs = 5000;
        private ProcessingCheckPolicy processingCheckPolicy;
        private AnalysisPolicy analysisPolicy;
        private Path auditDirectory;
        private int permanentFailureThreshold = TransactionLedger.DEFAULT_PERMANENT_FAILURE_THRESHOLD;
        private Duration dedupWindow = Duration.ofMinutes(15);
        private Duration dedupSweepInterval = Duration.ofMinutes(1);
        private int breakerFailureLimit = 5;
        private Duration breakerResetWindow = Duration.ofSeconds(60);
        private int modelCacheSize = 10;
        private long notificationIntervalMs = 30_000;
        private int notificationBatchSize = 50;
        private int notificationMaxAttempts = 5;
        private Duration notificationSkipRecent = Duration.ofSeconds(5);
        private RecordPurger transactionPurger;
        private RecordPurger notificationPurger;
        private Duration retention = Duration.ofDays(7);
        private Duration notificationRetention;
        private int retentionBatchSize = 500;
        private long retentionIntervalSeconds = 3600;
        private boolean recoverOnStart = true;
        private final AtomicBoolean built = new AtomicBoolean(false);

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param connectionProvider source of JDBC connections for the ledger and sweepers
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param transactionStore persistence for the ledger
         * @return this builder
         */
        public Builder transactionStore(TransactionStore transactionStore) {
            this.transactionStore = transactionStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param notificationStore persistence for pending notifications
         * @return this builder
         */
        public Builder notificationStore(NotificationStore notificationStore) {
            this.notificationStore = notificationStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param inferenceClient the inference backend
         * @return this builder
         */
        public Builder inferenceClient(InferenceClient inferenceClient) {
            this.inferenceClient = inferenceClient;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param transport the chat transport
         * @return this builder
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link ConversationConfig#defaults()} for every conversation.
         *
         * @param configSource per-conversation configuration
         * @return this builder
         */
        public Builder configSource(ConversationConfigSource configSource) {
            this.configSource = configSource;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link DefaultUserMessages}.
         *
         * @param messages texts sent to submitters
         * @return this builder
         */
        public Builder messages(UserMessages messages) {
            this.messages = messages;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link PromptTemplates#defaults()}.
         *
         * @param promptTemplates analysis prompts
         * @return this builder
         */
        public Builder promptTemplates(PromptTemplates promptTemplates) {
            this.promptTemplates = promptTemplates;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
         *
         * @param jsonCodec codec for audit metadata
         * @return this builder
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * <p>Optional. Defaults to the system UTC clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * <p>Optional. Defaults to an {@link InMemoryProblemJobSink} shared by all stages.
         *
         * @param problemJobs where failed jobs are kept
         * @return this builder
         */
        public Builder problemJobs(ProblemJobSink problemJobs) {
            this.problemJobs = problemJobs;
            return this;
        }

        /**
         * Sets the worker count of every stage without an explicit count.
         *
         * <p>Optional. Defaults to {@code 3}.
         *
         * @param workerCount workers per stage
         * @return this builder
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Sets the worker count of one stage.
         *
         * @param stage       the stage
         * @param workerCount workers for that stage
         * @return this builder
         */
        public Builder workerCount(StageName stage, int workerCount) {
            this.workerCounts.put(Objects.requireNonNull(stage, "stage"), workerCount);
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 1000} per stage.
         *
         * @param queueCapacity queued jobs per stage
         * @return this builder
         */
        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link JobOptions#defaults()}.
         *
         * @param jobOptions attempt and retention options shared by all stages
         * @return this builder
         */
        public Builder jobOptions(JobOptions jobOptions) {
            this.jobOptions = jobOptions;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param drainTimeoutMs drain timeout per stage on close
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link ProcessingCheckPolicy#defaults()}.
         *
         * @param processingCheckPolicy polling schedule and hard stops
         * @return this builder
         */
        public Builder processingCheckPolicy(ProcessingCheckPolicy processingCheckPolicy) {
            this.processingCheckPolicy = processingCheckPolicy;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link AnalysisPolicy#defaults()}.
         *
         * @param analysisPolicy upload and analysis timeouts
         * @return this builder
         */
        public Builder analysisPolicy(AnalysisPolicy analysisPolicy) {
            this.analysisPolicy = analysisPolicy;
            return this;
        }

        /**
         * Sets the directory where content blocked for safety reasons is copied.
         *
         * <p>Optional. By default blocked content is only kept in place.
         *
         * @param auditDirectory the audit directory
         * @return this builder
         */
        public Builder auditDirectory(Path auditDirectory) {
            this.auditDirectory = auditDirectory;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 3}.
         *
         * @param permanentFailureThreshold failures after which a transaction fails permanently
         * @return this builder
         */
        public Builder permanentFailureThreshold(int permanentFailureThreshold) {
            this.permanentFailureThreshold = permanentFailureThreshold;
            return this;
        }

        /**
         * <p>Optional. Defaults to 15 minutes, swept every minute.
         *
         * @param window        how long a submission id is remembered
         * @param sweepInterval how often expired ids are removed
         * @return this builder
         */
        public Builder dedup(Duration window, Duration sweepInterval) {
            this.dedupWindow = window;
            this.dedupSweepInterval = sweepInterval;
            return this;
        }

        /**
         * <p>Optional. Defaults to 5 failures and a 60 second reset window.
         *
         * @param failureLimit consecutive failures that open the breaker
         * @param resetWindow  how long the breaker stays open
         * @return this builder
         */
        public Builder circuitBreaker(int failureLimit, Duration resetWindow) {
            this.breakerFailureLimit = failureLimit;
            this.breakerResetWindow = resetWindow;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 10}.
         *
         * @param modelCacheSize model handles kept in the LRU cache
         * @return this builder
         */
        public Builder modelCacheSize(int modelCacheSize) {
            this.modelCacheSize = modelCacheSize;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 30000} ms.
         *
         * @param intervalMs delay between notification sweeps
         * @return this builder
         */
        public Builder notificationIntervalMs(long intervalMs) {
            this.notificationIntervalMs = intervalMs;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 50}.
         *
         * @param batchSize pending notifications per sweep
         * @return this builder
         */
        public Builder notificationBatchSize(int batchSize) {
            this.notificationBatchSize = batchSize;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 5}.
         *
         * @param maxAttempts failed retries after which a notification is abandoned
         * @return this builder
         */
        public Builder notificationMaxAttempts(int maxAttempts) {
            this.notificationMaxAttempts = maxAttempts;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 5s}.
         *
         * @param skipRecent grace period before a pending notification is retried
         * @return this builder
         */
        public Builder notificationSkipRecent(Duration skipRecent) {
            this.notificationSkipRecent = skipRecent;
            return this;
        }

        /**
         * Enables retention of terminal transactions. Without either purger no retention
         * sweep runs.
         *
         * @param purger deletes terminal transactions and their history
         * @return this builder
         */
        public Builder transactionPurger(RecordPurger purger) {
            this.transactionPurger = Objects.requireNonNull(purger, "purger");
            return this;
        }

        /**
         * Enables retention of abandoned notifications.
         *
         * @param purger deletes abandoned notifications
         * @return this builder
         */
        public Builder notificationPurger(RecordPurger purger) {
            this.notificationPurger = Objects.requireNonNull(purger, "purger");
            return this;
        }

        /**
         * <p>Optional. Defaults to the transaction retention.
         *
         * @param retention how long abandoned notifications stay available for replay
         * @return this builder
         */
        public Builder notificationRetention(Duration retention) {
            this.notificationRetention = retention;
            return this;
        }

        /**
         * <p>Optional. Defaults to 7 days, swept hourly in batches of 500.
         *
         * @param retention       how long terminal transactions are kept
         * @param batchSize       rows per purge batch
         * @param intervalSeconds seconds between sweeps
         * @return this builder
         */
        public Builder retention(Duration retention, int batchSize, long intervalSeconds) {
            this.retention = retention;
            this.retentionBatchSize = batchSize;
            this.retentionIntervalSeconds = intervalSeconds;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code true}.
         *
         * @param recoverOnStart whether {@link MediaPipeline#start()} replays interrupted deliveries
         * @return this builder
         */
        public Builder recoverOnStart(boolean recoverOnStart) {
            this.recoverOnStart = recoverOnStart;
            return this;
        }

        /**
         * Builds the pipeline and starts its stage workers.
         *
         * @return a new pipeline
         * @throws NullPointerException  if a required collaborator is missing
         * @throws IllegalStateException if this builder was already used
         */
        public MediaPipeline build() {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            Objects.requireNonNull(connectionProvider, "connectionProvider");
            Objects.requireNonNull(transactionStore, "transactionStore");
            Objects.requireNonNull(notificationStore, "notificationStore");
            Objects.requireNonNull(inferenceClient, "inferenceClient");
            Objects.requireNonNull(transport, "transport");
            return new MediaPipeline(this);
        }
    }
}
