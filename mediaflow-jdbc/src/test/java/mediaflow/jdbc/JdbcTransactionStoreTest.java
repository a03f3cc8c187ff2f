package mediaflow.jdbc;

import mediaflow.MediaKind;
import mediaflow.RecoveryData;
import mediaflow.jdbc.store.H2TransactionStore;
import mediaflow.model.HistoryEntry;
import mediaflow.model.Transaction;
import mediaflow.model.TransactionStatus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTransactionStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Set<TransactionStatus> OPEN = EnumSet.of(
            TransactionStatus.CREATED, TransactionStatus.PROCESSING, TransactionStatus.RESPONSE_GENERATED,
            TransactionStatus.FAILURE_TEMPORARY);

    private JdbcDataSource dataSource;
    private H2TransactionStore store;

    @BeforeEach
    void setUp() {
        dataSource = Schemas.newH2DataSource();
        store = new H2TransactionStore();
    }

    @Test
    void insertAndFindRoundTripsAllFields() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("tx-1", T0));
            store.setRecoveryData(conn, "tx-1", new RecoveryData("chat-9", "msg-3", "/media/a.jpg"), OPEN, T0);

            Transaction tx = store.find(conn, "tx-1").orElseThrow();
            assertEquals("sub-tx-1", tx.submissionId());
            assertEquals("chat-9", tx.conversationId());
            assertEquals("msg-3", tx.originId());
            assertEquals(MediaKind.IMAGE, tx.kind());
            assertEquals(TransactionStatus.CREATED, tx.status());
            assertEquals(0, tx.attempts());
            assertEquals(new RecoveryData("chat-9", "msg-3", "/media/a.jpg"), tx.recoveryData());
            assertNull(tx.response());
            assertEquals(T0, tx.createdAt());
            assertEquals(1, tx.history().size());
            assertEquals("created", tx.history().get(0).detail());
        }
    }

    @Test
    void findReturnsEmptyForUnknownId() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            assertEquals(Optional.empty(), store.find(conn, "missing"));
        }
    }

    @Test
    void duplicateIdIsRejected() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("tx-1", T0));
            assertThrows(StoreException.class, () -> store.insert(conn, created("tx-1", T0)));
        }
    }

    @Test
    void updateStatusHonoursExpectedStatuses() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("tx-1", T0));

            assertEquals(0, store.updateStatus(conn, "tx-1",
                    EnumSet.of(TransactionStatus.PROCESSING), TransactionStatus.DELIVERED, T0));
            assertEquals(1, store.updateStatus(conn, "tx-1",
                    EnumSet.of(TransactionStatus.CREATED), TransactionStatus.PROCESSING, T0.plusSeconds(1)));
            assertEquals(0, store.updateStatus(conn, "tx-1",
                    EnumSet.noneOf(TransactionStatus.class), TransactionStatus.DELIVERED, T0));
            assertEquals(0, store.updateStatus(conn, "missing",
                    EnumSet.of(TransactionStatus.CREATED), TransactionStatus.PROCESSING, T0));

            Transaction tx = store.find(conn, "tx-1").orElseThrow();
            assertEquals(TransactionStatus.PROCESSING, tx.status());
            assertEquals(T0.plusSeconds(1), tx.updatedAt());
        }
    }

    @Test
    void responseIsStoredOnlyOnce() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("tx-1", T0));

            assertEquals(1, store.setResponse(conn, "tx-1", "first", OPEN,
                    TransactionStatus.RESPONSE_GENERATED, T0));
            assertEquals(0, store.setResponse(conn, "tx-1", "second", OPEN,
                    TransactionStatus.RESPONSE_GENERATED, T0));

            Transaction tx = store.find(conn, "tx-1").orElseThrow();
            assertEquals("first", tx.response());
            assertEquals(TransactionStatus.RESPONSE_GENERATED, tx.status());
        }
    }

    @Test
    void recordFailureEscalatesAtThreshold() throws SQLException {
        Set<TransactionStatus> sources = TransactionStatus.sourcesOf(TransactionStatus.FAILURE_TEMPORARY);
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("tx-1", T0));

            assertEquals(1, store.recordFailure(conn, "tx-1", "boom 1", 3, sources, T0));
            assertEquals(TransactionStatus.FAILURE_TEMPORARY, store.find(conn, "tx-1").orElseThrow().status());
            assertEquals(1, store.recordFailure(conn, "tx-1", "boom 2", 3, sources, T0));
            assertEquals(1, store.recordFailure(conn, "tx-1", "boom 3", 3, sources, T0));

            Transaction tx = store.find(conn, "tx-1").orElseThrow();
            assertEquals(TransactionStatus.FAILURE_PERMANENT, tx.status());
            assertEquals(3, tx.attempts());
            assertEquals("boom 3", tx.lastError());

            assertEquals(0, store.recordFailure(conn, "tx-1", "boom 4", 3, sources, T0));
            assertEquals(3, store.find(conn, "tx-1").orElseThrow().attempts());
        }
    }

    @Test
    void longErrorsAreTruncated() throws SQLException {
        String error = "x".repeat(5000);
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("tx-1", T0));
            store.recordFailure(conn, "tx-1", error, 5,
                    TransactionStatus.sourcesOf(TransactionStatus.FAILURE_TEMPORARY), T0);

            String stored = store.find(conn, "tx-1").orElseThrow().lastError();
            assertEquals(4000, stored.length());
            assertTrue(stored.endsWith("..."));
        }
    }

    @Test
    void historyIsReturnedInAppendOrder() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("tx-1", T0));
            store.appendHistory(conn, "tx-1", new HistoryEntry(T0.plusSeconds(2), TransactionStatus.PROCESSING, "b"));
            store.appendHistory(conn, "tx-1", new HistoryEntry(T0.plusSeconds(1), TransactionStatus.PROCESSING, "c"));

            List<HistoryEntry> history = store.find(conn, "tx-1").orElseThrow().history();
            assertEquals(List.of("created", "b", "c"), history.stream().map(HistoryEntry::detail).toList());
        }
    }

    @Test
    void findIncompleteReturnsResumableOldestFirst() throws SQLException {
        RecoveryData rd = new RecoveryData("chat-1", "msg-1", null);
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("newer", T0.plusSeconds(10)));
            store.insert(conn, created("older", T0));
            store.insert(conn, created("no-response", T0));
            store.insert(conn, created("delivered", T0));
            for (String id : List.of("newer", "older", "no-response", "delivered")) {
                store.setRecoveryData(conn, id, rd, OPEN, T0);
            }
            store.setResponse(conn, "newer", "r", OPEN, TransactionStatus.RESPONSE_GENERATED, T0);
            store.setResponse(conn, "older", "r", OPEN, TransactionStatus.RESPONSE_GENERATED, T0);
            store.setResponse(conn, "delivered", "r", OPEN, TransactionStatus.RESPONSE_GENERATED, T0);
            store.updateStatus(conn, "delivered", OPEN, TransactionStatus.DELIVERED, T0);

            List<Transaction> incomplete = store.findIncomplete(conn, 10);
            assertEquals(List.of("older", "newer"), incomplete.stream().map(Transaction::id).toList());
            assertEquals(1, incomplete.get(0).history().size());
            assertEquals(1, store.findIncomplete(conn, 1).size());
        }
    }

    @Test
    void findIncompleteIncludesInterruptedRecovery() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("interrupted", T0));
            store.setRecoveryData(conn, "interrupted", new RecoveryData("chat-1", "msg-1", null), OPEN, T0);
            store.setResponse(conn, "interrupted", "r", OPEN, TransactionStatus.RESPONSE_GENERATED, T0);
            store.updateStatus(conn, "interrupted", EnumSet.of(TransactionStatus.RESPONSE_GENERATED),
                    TransactionStatus.RECOVERY_IN_PROGRESS, T0);

            List<Transaction> incomplete = store.findIncomplete(conn, 10);
            assertEquals(1, incomplete.size());
            assertEquals(TransactionStatus.RECOVERY_IN_PROGRESS, incomplete.get(0).status());
        }
    }

    @Test
    void countByStatusGroupsRows() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, created("a", T0));
            store.insert(conn, created("b", T0));
            store.insert(conn, created("c", T0));
            store.updateStatus(conn, "c", OPEN, TransactionStatus.PROCESSING, T0);

            Map<TransactionStatus, Long> counts = store.countByStatus(conn);
            assertEquals(2L, counts.get(TransactionStatus.CREATED));
            assertEquals(1L, counts.get(TransactionStatus.PROCESSING));
            assertNull(counts.get(TransactionStatus.DELIVERED));
        }
    }

    @Test
    void customTableNamesAreUsed() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.createStatement().execute("CREATE TABLE tx_alt AS SELECT * FROM media_transaction WHERE 1=0");
            conn.createStatement().execute(
                    "CREATE TABLE tx_alt_history (entry_id BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                            "transaction_id VARCHAR(64) NOT NULL, recorded_at TIMESTAMP NOT NULL, " +
                            "status INT NOT NULL, detail CLOB NOT NULL)");
            H2TransactionStore custom = new H2TransactionStore("tx_alt", "tx_alt_history");
            custom.insert(conn, created("tx-1", T0));

            assertTrue(custom.find(conn, "tx-1").isPresent());
            assertTrue(store.find(conn, "tx-1").isEmpty());
        }
    }

    static Transaction created(String id, Instant at) {
        return new Transaction(id, "sub-" + id, "chat-9", "msg-3", MediaKind.IMAGE,
                TransactionStatus.CREATED, 0, null, null, null,
                List.of(new HistoryEntry(at, TransactionStatus.CREATED, "created")), at, at);
    }
}
