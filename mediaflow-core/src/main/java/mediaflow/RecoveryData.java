package mediaflow;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal durable data needed to deliver a result without the original inbound event.
 *
 * @param destination     where the answer is sent (the conversation address)
 * @param originId        identifier of the inbound message, used for the reply form; may be {@code null}
 * @param contentRef      reference to the original local content; may be {@code null}
 */
public record RecoveryData(String destination, String originId, String contentRef) {
    private static final String DESTINATION = "destination";
    private static final String ORIGIN_ID = "originId";
    private static final String CONTENT_REF = "contentRef";

    public RecoveryData {
        Objects.requireNonNull(destination, "destination");
        if (destination.isEmpty()) {
            throw new IllegalArgumentException("destination cannot be empty");
        }
    }

    /**
     * Flattens this record for persistence through a {@link mediaflow.util.JsonCodec}.
     *
     * @return an ordered map without {@code null} values
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(DESTINATION, destination);
        if (originId != null) {
            map.put(ORIGIN_ID, originId);
        }
        if (contentRef != null) {
            map.put(CONTENT_REF, contentRef);
        }
        return map;
    }

    /**
     * Restores a record previously produced by {@link #toMap()}.
     *
     * @param map the persisted fields
     * @return the recovery data
     * @throws IllegalArgumentException if the destination is missing
     */
    public static RecoveryData fromMap(Map<String, String> map) {
        String destination = map.get(DESTINATION);
        if (destination == null) {
            throw new IllegalArgumentException("recovery data has no destination");
        }
        return new RecoveryData(destination, map.get(ORIGIN_ID), map.get(CONTENT_REF));
    }
}
