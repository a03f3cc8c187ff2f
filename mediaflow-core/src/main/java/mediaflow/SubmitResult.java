package mediaflow;

/**
 * Outcome of {@link MediaPipeline#submit(Submission)}.
 */
public enum SubmitResult {
    /** A transaction was created and the job entered the entry queue. */
    ACCEPTED,
    /** The submission id was seen within the dedup window; nothing was enqueued. */
    DUPLICATE,
    /** The conversation has this media kind turned off. */
    DISABLED,
    /** The submission kind is not handled by the stage queues. */
    UNSUPPORTED,
    /** The entry queue was full; the transaction was recorded as a temporary failure. */
    REJECTED
}
