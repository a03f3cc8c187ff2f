package mediaflow.ai;

import java.util.Objects;

/**
 * Reference to a file stored by the inference backend.
 *
 * @param name     backend identifier used for status queries and deletion
 * @param uri      URI referenced from prompts
 * @param mimeType content type reported by the backend
 * @param state    processing state at the time of the query
 */
public record RemoteFile(String name, String uri, String mimeType, RemoteFileState state) {
    public RemoteFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(state, "state");
    }
}
