package mediaflow.dispatch;

import mediaflow.model.DeliveryStatus;
import mediaflow.model.PendingNotification;
import mediaflow.spi.ConnectionProvider;
import mediaflow.spi.NotificationStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Inspects and replays notifications that the recovery sweep gave up on.
 */
public final class AbandonedNotificationManager {
    private static final Logger logger = Logger.getLogger(AbandonedNotificationManager.class.getName());

    private final ConnectionProvider connectionProvider;
    private final NotificationStore notificationStore;

    public AbandonedNotificationManager(ConnectionProvider connectionProvider, NotificationStore notificationStore) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.notificationStore = Objects.requireNonNull(notificationStore, "notificationStore");
    }

    /**
     * Lists abandoned notifications, oldest first.
     */
    public List<PendingNotification> query(int limit) {
        try (Connection conn = connectionProvider.getConnection()) {
            return notificationStore.findByStatus(conn, DeliveryStatus.ABANDONED, limit);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to query abandoned notifications", e);
            return List.of();
        }
    }

    /**
     * Returns one abandoned notification to the pending state so the sweep retries it.
     *
     * @return {@code true} if the record was abandoned and is now pending
     */
    public boolean replay(String notificationId) {
        try (Connection conn = connectionProvider.getConnection()) {
            return notificationStore.resetToPending(conn, notificationId) > 0;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to replay notification " + notificationId, e);
            return false;
        }
    }

    /**
     * Replays every abandoned notification in batches.
     *
     * @return the number of records replayed
     */
    public int replayAll(int batchSize) {
        int replayed = 0;
        List<PendingNotification> batch;
        int batchReplayed;
        do {
            batchReplayed = 0;
            try (Connection conn = connectionProvider.getConnection()) {
                batch = notificationStore.findByStatus(conn, DeliveryStatus.ABANDONED, batchSize);
                for (PendingNotification notification : batch) {
                    batchReplayed += notificationStore.resetToPending(conn, notification.id());
                }
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Failed to replay abandoned notifications", e);
                break;
            }
            replayed += batchReplayed;
        } while (batchReplayed > 0 && batch.size() >= batchSize);
        return replayed;
    }

    public int count() {
        try (Connection conn = connectionProvider.getConnection()) {
            return notificationStore.countByStatus(conn, DeliveryStatus.ABANDONED);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to count abandoned notifications", e);
            return 0;
        }
    }
}
