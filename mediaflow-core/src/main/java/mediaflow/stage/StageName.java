package mediaflow.stage;

/**
 * The four stage queues, in pipeline order.
 */
public enum StageName {
    /** Stable external enqueue point; forwards to {@link #UPLOAD}. */
    ENTRY("entry"),
    UPLOAD("upload"),
    PROCESSING_CHECK("processingCheck"),
    ANALYSIS("analysis");

    private final String key;

    StageName(String key) {
        this.key = key;
    }

    /**
     * Identifier used in thread names, metric tags and status reports.
     *
     * @return the stage key
     */
    public String key() {
        return key;
    }
}
