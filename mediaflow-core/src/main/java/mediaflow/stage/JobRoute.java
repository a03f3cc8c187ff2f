package mediaflow.stage;

import java.util.Objects;

/**
 * Routing identifiers every job carries from submission to delivery.
 *
 * @param transactionId  the ledger record
 * @param conversationId where the answer goes
 * @param originId       inbound message to quote, may be {@code null}
 */
public record JobRoute(String transactionId, String conversationId, String originId) {
    public JobRoute {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(conversationId, "conversationId");
    }
}
