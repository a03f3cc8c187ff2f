package mediaflow.ledger;

import mediaflow.MediaKind;
import mediaflow.RecoveryData;
import mediaflow.dispatch.ResultDispatcher;
import mediaflow.error.DefaultUserMessages;
import mediaflow.model.DeliveryStatus;
import mediaflow.model.HistoryEntry;
import mediaflow.model.PendingNotification;
import mediaflow.model.Transaction;
import mediaflow.model.TransactionStatus;
import mediaflow.stubs.Connections;
import mediaflow.stubs.InMemoryNotificationStore;
import mediaflow.stubs.InMemoryTransactionStore;
import mediaflow.stubs.MutableClock;
import mediaflow.stubs.RecordingTransport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TransactionRecoveryTest {

    private final MutableClock clock = MutableClock.at("2024-01-01T01:00:00Z");
    private final InMemoryTransactionStore transactions = new InMemoryTransactionStore();
    private final InMemoryNotificationStore notifications = new InMemoryNotificationStore();
    private final RecordingTransport transport = new RecordingTransport();
    private final TransactionLedger ledger =
            new TransactionLedger(Connections.dummyProvider(), transactions, clock, 3);
    private final ResultDispatcher dispatcher = ResultDispatcher.builder()
            .transport(transport)
            .ledger(ledger)
            .connectionProvider(Connections.dummyProvider())
            .notificationStore(notifications)
            .messages(new DefaultUserMessages())
            .clock(clock)
            .build();
    private final TransactionRecovery recovery = new TransactionRecovery(ledger, dispatcher);

    /** Seeds a record as if the process had stopped after the response was generated. */
    private void seed(String id, TransactionStatus status, String response) {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        transactions.put(new Transaction(id, "evt-" + id, "chat-1", "msg-" + id, MediaKind.VIDEO, status, 0,
                new RecoveryData("chat-1", "msg-" + id, "/tmp/" + id + ".mp4"), response, null,
                List.of(new HistoryEntry(created, TransactionStatus.CREATED, "seeded")), created, created));
    }

    @Test
    void redeliversStoredResponseWithoutInboundEvent() {
        seed("tx_1", TransactionStatus.RESPONSE_GENERATED, "stored description");

        TransactionRecovery.RecoveryReport report = recovery.recover();

        assertEquals(new TransactionRecovery.RecoveryReport(1, 1, 0, 0), report);
        assertEquals("stored description", transport.sent().get(0).text());
        assertEquals("chat-1", transport.sent().get(0).destination());
        Transaction tx = ledger.find("tx_1").orElseThrow();
        assertEquals(TransactionStatus.DELIVERED, tx.status());
        List<TransactionStatus> trail = tx.history().stream().map(HistoryEntry::status).collect(Collectors.toList());
        assertEquals(List.of(TransactionStatus.CREATED, TransactionStatus.RECOVERY_IN_PROGRESS,
                TransactionStatus.PROCESSING, TransactionStatus.DELIVERED), trail);
    }

    @Test
    void resumesRecoveryInterruptedByShutdown() {
        seed("tx_1", TransactionStatus.RECOVERY_IN_PROGRESS, "stored description");

        assertEquals(new TransactionRecovery.RecoveryReport(1, 1, 0, 0), recovery.recover());
        Transaction tx = ledger.find("tx_1").orElseThrow();
        assertEquals(TransactionStatus.DELIVERED, tx.status());
        List<TransactionStatus> trail = tx.history().stream().map(HistoryEntry::status).collect(Collectors.toList());
        assertEquals(List.of(TransactionStatus.CREATED, TransactionStatus.PROCESSING, TransactionStatus.DELIVERED),
                trail);
        assertEquals(1, transport.sent().size());
    }

    @Test
    void failedResumeLeavesTransactionRetryable() {
        seed("tx_1", TransactionStatus.RECOVERY_IN_PROGRESS, "text");
        transport.failAll(true);

        assertEquals(new TransactionRecovery.RecoveryReport(1, 0, 0, 1), recovery.recover());
        assertEquals(TransactionStatus.FAILURE_TEMPORARY, ledger.find("tx_1").orElseThrow().status());
        assertEquals(1, notifications.all().size());
    }

    @Test
    void ignoresRecordsWithoutResponse() {
        seed("tx_1", TransactionStatus.PROCESSING, null);

        assertEquals(new TransactionRecovery.RecoveryReport(0, 0, 0, 0), recovery.recover());
        assertEquals(TransactionStatus.PROCESSING, ledger.find("tx_1").orElseThrow().status());
    }

    @Test
    void ignoresTerminalRecords() {
        seed("tx_1", TransactionStatus.DELIVERED, "done");
        seed("tx_2", TransactionStatus.FAILURE_PERMANENT, "failed");

        assertEquals(0, recovery.recover().found());
        assertEquals(0, transport.sent().size());
    }

    @Test
    void skipsTransactionOwnedByPendingNotification() {
        seed("tx_1", TransactionStatus.FAILURE_TEMPORARY, "text");
        notifications.insert(null, new PendingNotification("ntf_1", "tx_1", "chat-1", "text", "msg-tx_1", null, 1,
                clock.instant(), null, DeliveryStatus.PENDING, "network down"));

        assertEquals(new TransactionRecovery.RecoveryReport(1, 0, 1, 0), recovery.recover());
        assertEquals(TransactionStatus.FAILURE_TEMPORARY, ledger.find("tx_1").orElseThrow().status());
    }

    @Test
    void failedRedeliveryLeavesPendingNotification() {
        seed("tx_1", TransactionStatus.RESPONSE_GENERATED, "text");
        transport.failAll(true);

        assertEquals(new TransactionRecovery.RecoveryReport(1, 0, 0, 1), recovery.recover());
        Transaction tx = ledger.find("tx_1").orElseThrow();
        assertEquals(TransactionStatus.FAILURE_TEMPORARY, tx.status());
        assertEquals(1, notifications.all().size());
    }

    @Test
    void secondPassFindsNothing() {
        seed("tx_1", TransactionStatus.RESPONSE_GENERATED, "text");
        recovery.recover();

        assertEquals(0, recovery.recover().found());
        assertEquals(1, transport.sent().size());
    }
}
