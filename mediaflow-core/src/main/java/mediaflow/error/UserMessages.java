package mediaflow.error;

import mediaflow.MediaKind;

/**
 * Texts sent to the submitter. Implementations never include raw error text,
 * stack traces or internal identifiers.
 *
 * @see DefaultUserMessages
 */
public interface UserMessages {

    /**
     * Message for a terminal failure, distinct per classification.
     */
    String failure(FailureKind kind, MediaKind media);

    /**
     * Periodic notice sent while the backend is still processing an upload.
     */
    String stillProcessing(MediaKind media);

    /**
     * One-time notice sent when processing takes longer than usual.
     */
    String takingLonger(MediaKind media);

    /**
     * Answer used when the model returned no text.
     */
    String emptyResponse(MediaKind media);
}
