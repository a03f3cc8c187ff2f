package mediaflow.model;

import mediaflow.RecoveryData;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable record of a message the dispatcher could not deliver.
 *
 * @see mediaflow.dispatch.NotificationRecoverySweeper
 */
public record PendingNotification(
        String id,
        String transactionId,
        String destination,
        String content,
        String quotedMessageId,
        RecoveryData recoveryData,
        int attempts,
        Instant createdAt,
        Instant lastAttemptAt,
        DeliveryStatus deliveryStatus,
        String lastError
) {
    public PendingNotification {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(deliveryStatus, "deliveryStatus");
    }
}
