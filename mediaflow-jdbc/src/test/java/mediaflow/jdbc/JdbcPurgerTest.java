package mediaflow.jdbc;

import mediaflow.jdbc.purge.H2TransactionPurger;
import mediaflow.jdbc.purge.JdbcNotificationPurger;
import mediaflow.jdbc.store.H2TransactionStore;
import mediaflow.jdbc.store.JdbcNotificationStore;
import mediaflow.model.DeliveryStatus;
import mediaflow.model.TransactionStatus;
import mediaflow.purge.RetentionSweeper;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcPurgerTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private JdbcDataSource dataSource;
    private H2TransactionStore transactions;
    private JdbcNotificationStore notifications;

    @BeforeEach
    void setUp() {
        dataSource = Schemas.newH2DataSource();
        transactions = new H2TransactionStore();
        notifications = new JdbcNotificationStore();
    }

    @Test
    void transactionPurgerDeletesOnlyOldTerminalRecordsWithHistory() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            insertWithStatus(conn, "old-delivered", TransactionStatus.DELIVERED, T0);
            insertWithStatus(conn, "old-failed", TransactionStatus.FAILURE_PERMANENT, T0);
            insertWithStatus(conn, "old-open", TransactionStatus.PROCESSING, T0);
            insertWithStatus(conn, "new-delivered", TransactionStatus.DELIVERED, T0.plus(Duration.ofDays(10)));

            int purged = new H2TransactionPurger().purge(conn, T0.plus(Duration.ofDays(1)), 100);

            assertEquals(2, purged);
            assertTrue(transactions.find(conn, "old-delivered").isEmpty());
            assertTrue(transactions.find(conn, "old-failed").isEmpty());
            assertTrue(transactions.find(conn, "old-open").isPresent());
            assertTrue(transactions.find(conn, "new-delivered").isPresent());
            assertEquals(0L, LedgerSql.count(conn,
                    "SELECT COUNT(*) FROM transaction_history WHERE transaction_id='old-delivered'"));
        }
    }

    @Test
    void transactionPurgerRespectsBatchLimit() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (int i = 0; i < 5; i++) {
                insertWithStatus(conn, "tx-" + i, TransactionStatus.DELIVERED, T0.plusSeconds(i));
            }
            H2TransactionPurger purger = new H2TransactionPurger();

            assertEquals(2, purger.purge(conn, T0.plus(Duration.ofDays(1)), 2));
            assertTrue(transactions.find(conn, "tx-0").isEmpty());
            assertTrue(transactions.find(conn, "tx-2").isPresent());
            assertEquals(3, purger.purge(conn, T0.plus(Duration.ofDays(1)), 10));
        }
    }

    @Test
    void notificationPurgerLeavesPendingRecords() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            notifications.insert(conn, JdbcNotificationStoreTest.pending("pending", "tx-1", T0));
            notifications.insert(conn, JdbcNotificationStoreTest.pending("abandoned", "tx-2", T0));
            notifications.insert(conn, JdbcNotificationStoreTest.pending("fresh", "tx-3", T0));
            notifications.markAbandoned(conn, "abandoned", T0.plusSeconds(1), "gave up");
            notifications.markAbandoned(conn, "fresh", T0.plus(Duration.ofDays(5)), "gave up");

            int purged = new JdbcNotificationPurger().purge(conn, T0.plus(Duration.ofDays(1)), 100);

            assertEquals(1, purged);
            assertEquals(1, notifications.countByStatus(conn, DeliveryStatus.PENDING));
            assertEquals(1, notifications.countByStatus(conn, DeliveryStatus.ABANDONED));
        }
    }

    @Test
    void retentionSweeperDrainsBothTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (int i = 0; i < 7; i++) {
                insertWithStatus(conn, "tx-" + i, TransactionStatus.DELIVERED, T0);
            }
            notifications.insert(conn, JdbcNotificationStoreTest.pending("n-1", "tx-1", T0));
            notifications.markAbandoned(conn, "n-1", T0, "gave up");
        }
        Clock clock = Clock.fixed(T0.plus(Duration.ofDays(8)), ZoneOffset.UTC);
        try (RetentionSweeper sweeper = RetentionSweeper.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .transactionPurger(new H2TransactionPurger())
                .notificationPurger(new JdbcNotificationPurger())
                .transactionRetention(Duration.ofDays(7))
                .batchSize(3)
                .clock(clock)
                .build()) {
            RetentionSweeper.PurgeReport report = sweeper.runOnce();
            assertEquals(7, report.transactionsPurged());
            assertEquals(1, report.notificationsPurged());
            assertTrue(report.failed().isEmpty());
        }
    }

    private void insertWithStatus(Connection conn, String id, TransactionStatus status, Instant updatedAt) {
        transactions.insert(conn, JdbcTransactionStoreTest.created(id, T0));
        if (status != TransactionStatus.CREATED) {
            transactions.updateStatus(conn, id, EnumSet.of(TransactionStatus.CREATED), status, updatedAt);
        }
    }
}
