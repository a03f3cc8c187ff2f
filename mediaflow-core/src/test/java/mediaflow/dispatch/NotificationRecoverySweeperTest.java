package mediaflow.dispatch;

import mediaflow.RecoveryData;
import mediaflow.Submission;
import mediaflow.error.DefaultUserMessages;
import mediaflow.ledger.TransactionLedger;
import mediaflow.model.DeliveryStatus;
import mediaflow.model.PendingNotification;
import mediaflow.model.Transaction;
import mediaflow.model.TransactionStatus;
import mediaflow.stubs.Connections;
import mediaflow.stubs.InMemoryNotificationStore;
import mediaflow.stubs.InMemoryTransactionStore;
import mediaflow.stubs.MutableClock;
import mediaflow.stubs.RecordingTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationRecoverySweeperTest {

    private final MutableClock clock = MutableClock.at("2024-01-01T00:00:00Z");
    private final InMemoryTransactionStore transactions = new InMemoryTransactionStore();
    private final InMemoryNotificationStore notifications = new InMemoryNotificationStore();
    private final RecordingTransport transport = new RecordingTransport();
    private final TransactionLedger ledger =
            new TransactionLedger(Connections.dummyProvider(), transactions, clock, 10);

    private NotificationRecoverySweeper sweeper(int maxAttempts) {
        return NotificationRecoverySweeper.builder()
                .connectionProvider(Connections.dummyProvider())
                .notificationStore(notifications)
                .transport(transport)
                .ledger(ledger)
                .maxAttempts(maxAttempts)
                .skipRecent(Duration.ofSeconds(5))
                .clock(clock)
                .build();
    }

    /** Drives a transaction into a failed delivery that leaves a pending notification. */
    private String failedDelivery() {
        ResultDispatcher dispatcher = ResultDispatcher.builder()
                .transport(transport)
                .ledger(ledger)
                .connectionProvider(Connections.dummyProvider())
                .notificationStore(notifications)
                .messages(new DefaultUserMessages())
                .clock(clock)
                .build();
        Transaction tx = ledger.create(Submission.builder("evt-" + transactions.size())
                .conversationId("chat-1")
                .originId("msg-1")
                .mimeType("video/mp4")
                .contentRef("/tmp/v.mp4")
                .build());
        RecoveryData recoveryData = new RecoveryData("chat-1", "msg-1", "/tmp/v.mp4");
        ledger.attachRecoveryData(tx.id(), recoveryData);
        ledger.markProcessing(tx.id());
        transport.failAll(true);
        dispatcher.deliver(new DeliveryTarget(tx.id(), recoveryData), Delivery.response("the video"));
        transport.failAll(false);
        return tx.id();
    }

    @Test
    void skipsRecentRecords() {
        failedDelivery();

        assertEquals(0, sweeper(5).runOnce());
        assertEquals(1, notifications.all().size());
    }

    @Test
    void deliversAndMarksTransactionDelivered() {
        String txId = failedDelivery();
        clock.advance(Duration.ofSeconds(6));

        assertEquals(1, sweeper(5).runOnce());

        assertTrue(notifications.all().isEmpty());
        assertEquals(TransactionStatus.DELIVERED, ledger.find(txId).orElseThrow().status());
        assertEquals("the video", transport.sent().get(0).text());
    }

    @Test
    void failedRetryIncrementsAttempts() {
        failedDelivery();
        clock.advance(Duration.ofSeconds(6));
        transport.failAll(true);

        assertEquals(0, sweeper(5).runOnce());

        PendingNotification notification = notifications.all().get(0);
        assertEquals(1, notification.attempts());
        assertEquals(DeliveryStatus.PENDING, notification.deliveryStatus());
    }

    @Test
    void abandonsAfterMaxAttempts() {
        failedDelivery();
        clock.advance(Duration.ofSeconds(6));
        transport.failAll(true);
        NotificationRecoverySweeper sweeper = sweeper(2);

        sweeper.runOnce();
        sweeper.runOnce();

        PendingNotification notification = notifications.all().get(0);
        assertEquals(DeliveryStatus.ABANDONED, notification.deliveryStatus());
        assertEquals(2, notification.attempts());
        assertEquals(0, sweeper.runOnce());
    }

    @Test
    void failingConnectionReturnsZero() {
        NotificationRecoverySweeper sweeper = NotificationRecoverySweeper.builder()
                .connectionProvider(Connections.failingProvider())
                .notificationStore(notifications)
                .transport(transport)
                .ledger(ledger)
                .build();

        assertEquals(0, sweeper.runOnce());
    }

    @Test
    void closedSweeperDoesNothing() {
        failedDelivery();
        clock.advance(Duration.ofSeconds(6));
        NotificationRecoverySweeper sweeper = sweeper(5);
        sweeper.close();

        assertEquals(0, sweeper.runOnce());
        assertThrows(IllegalStateException.class, sweeper::start);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> NotificationRecoverySweeper.builder()
                .connectionProvider(Connections.dummyProvider())
                .notificationStore(notifications)
                .transport(transport)
                .ledger(ledger)
                .batchSize(0)
                .build());
        assertThrows(IllegalArgumentException.class, () -> NotificationRecoverySweeper.builder()
                .connectionProvider(Connections.dummyProvider())
                .notificationStore(notifications)
                .transport(transport)
                .ledger(ledger)
                .skipRecent(Duration.ofSeconds(-1))
                .build());
    }
}
