package mediaflow.stage;

import mediaflow.DescriptionMode;
import mediaflow.MediaKind;
import mediaflow.RecoveryData;
import mediaflow.Submission;
import mediaflow.ai.InferenceGateway;
import mediaflow.ai.ModelCache;
import mediaflow.dispatch.ResultDispatcher;
import mediaflow.error.DefaultUserMessages;
import mediaflow.guard.CircuitBreaker;
import mediaflow.ledger.TransactionLedger;
import mediaflow.model.Transaction;
import mediaflow.model.TransactionStatus;
import mediaflow.spi.GenerativeModel;
import mediaflow.stubs.Connections;
import mediaflow.stubs.FakeInferenceClient;
import mediaflow.stubs.InMemoryNotificationStore;
import mediaflow.stubs.InMemoryTransactionStore;
import mediaflow.stubs.MutableClock;
import mediaflow.stubs.RecordingTransport;
import mediaflow.util.JsonCodec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the collaborators a stage handler needs against in-memory stores.
 */
final class StageFixture implements AutoCloseable {
    final MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
    final InMemoryTransactionStore transactions = new InMemoryTransactionStore();
    final InMemoryNotificationStore notifications = new InMemoryNotificationStore();
    final RecordingTransport transport = new RecordingTransport();
    final FakeInferenceClient client = new FakeInferenceClient();
    final DefaultUserMessages messages = new DefaultUserMessages();
    final CircuitBreaker breaker;
    final InferenceGateway gateway;
    final TransactionLedger ledger;
    final ResultDispatcher dispatcher;
    final ArtifactCleaner cleaner;
    final StageSupport support;

    StageFixture(Path auditDirectory, int permanentFailureThreshold) {
        breaker = CircuitBreaker.builder().failureLimit(5).resetWindow(Duration.ofSeconds(60)).clock(clock).build();
        gateway = new InferenceGateway(client, breaker, new ModelCache<GenerativeModel>(4));
        ledger = new TransactionLedger(Connections.dummyProvider(), transactions, clock, permanentFailureThreshold);
        dispatcher = ResultDispatcher.builder()
                .transport(transport)
                .ledger(ledger)
                .connectionProvider(Connections.dummyProvider())
                .notificationStore(notifications)
                .messages(messages)
                .clock(clock)
                .build();
        cleaner = new ArtifactCleaner(gateway, auditDirectory, JsonCodec.getDefault(), clock);
        support = new StageSupport(ledger, dispatcher, cleaner);
    }

    StageFixture() {
        this(null, 3);
    }

    /** Creates a file with some bytes in {@code dir}. */
    static Path content(Path dir, String name) throws IOException {
        return Files.write(dir.resolve(name), new byte[]{1, 2, 3, 4});
    }

    /** Records a transaction for {@code content} and returns its route. */
    JobRoute transaction(Path content, MediaKind kind, boolean processing) {
        Transaction tx = ledger.create(Submission.builder("evt-" + transactions.size())
                .conversationId("chat-1")
                .originId("msg-1")
                .kind(kind)
                .contentRef(content.toString())
                .build());
        ledger.attachRecoveryData(tx.id(), new RecoveryData("chat-1", "msg-1", content.toString()));
        if (processing) {
            ledger.markProcessing(tx.id());
        }
        return new JobRoute(tx.id(), "chat-1", "msg-1");
    }

    static MediaPayload payload(Path content, MediaKind kind) {
        String mime = kind == MediaKind.VIDEO ? "video/mp4" : "image/jpeg";
        return new MediaPayload(kind, content.toString(), mime, null, DescriptionMode.SHORT);
    }

    TransactionStatus status(JobRoute route) {
        return ledger.find(route.transactionId()).orElseThrow().status();
    }

    @Override
    public void close() {
        gateway.close();
    }
}
