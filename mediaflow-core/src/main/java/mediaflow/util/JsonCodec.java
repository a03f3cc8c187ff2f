package mediaflow.util;

import java.util.Map;

/**
 * Converts flat string maps to and from JSON object text.
 *
 * <p>Used to persist {@link mediaflow.RecoveryData} and blocked-content metadata without
 * pulling a JSON library into the core module. Applications that already carry Jackson or
 * Gson can supply their own implementation to the JDBC stores.
 *
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the shared built-in codec.
     *
     * @return the default codec
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object. Entries with {@code null} values are written as JSON
     * {@code null}; an empty map encodes as {@code "{}"}.
     *
     * @param values the map to encode, not {@code null}
     * @return JSON object text
     * @throws IllegalArgumentException if the map contains a {@code null} key
     */
    String encode(Map<String, String> values);

    /**
     * Decodes a JSON object whose values are strings or {@code null}. Keys mapped to JSON
     * {@code null} are omitted. Blank or {@code null} input decodes to an empty map.
     *
     * @param json JSON object text
     * @return an insertion-ordered map, never {@code null}
     * @throws IllegalArgumentException if the text is not a flat JSON object of strings
     */
    Map<String, String> decode(String json);
}
