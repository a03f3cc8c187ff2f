package mediaflow.spi;

import mediaflow.model.DeliveryStatus;
import mediaflow.model.PendingNotification;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Persistence backend for pending-notification records written when the dispatcher
 * cannot reach the transport.
 *
 * @see mediaflow.dispatch.ResultDispatcher
 * @see mediaflow.dispatch.NotificationRecoverySweeper
 */
public interface NotificationStore {

    void insert(Connection conn, PendingNotification notification);

    /**
     * Returns pending records created at or before {@code createdBefore}, oldest first.
     */
    List<PendingNotification> pollPending(Connection conn, Instant createdBefore, int limit);

    /**
     * Deletes a record after its content was delivered.
     */
    int delete(Connection conn, String id);

    /**
     * Increments the attempt counter of a pending record.
     */
    int markAttempt(Connection conn, String id, Instant at, String error);

    /**
     * Moves a pending record to the abandoned sink.
     */
    int markAbandoned(Connection conn, String id, Instant at, String error);

    /**
     * Returns an abandoned record to the pending state with a zero attempt counter.
     */
    int resetToPending(Connection conn, String id);

    List<PendingNotification> findByStatus(Connection conn, DeliveryStatus status, int limit);

    int countByStatus(Connection conn, DeliveryStatus status);

    /**
     * Whether a pending record exists for the given transaction.
     */
    boolean hasPending(Connection conn, String transactionId);
}
