package mediaflow.ai;

/**
 * Processing state of a file stored by the inference backend.
 */
public enum RemoteFileState {
    PROCESSING,
    ACTIVE,
    SUCCEEDED,
    FAILED;

    /**
     * Whether the file can be referenced in a prompt.
     *
     * @return {@code true} for {@code ACTIVE} and {@code SUCCEEDED}
     */
    public boolean isReady() {
        return this == ACTIVE || this == SUCCEEDED;
    }
}
