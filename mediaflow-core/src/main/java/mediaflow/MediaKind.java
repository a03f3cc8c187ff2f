package mediaflow;

import java.util.Locale;

/**
 * Kind of content carried by a submission.
 *
 * <p>Only {@link #IMAGE} and {@link #VIDEO} flow through the stage queues; the other kinds
 * are recorded for completeness and rejected by {@link MediaPipeline#submit(Submission)}.
 */
public enum MediaKind {
    TEXT,
    IMAGE,
    VIDEO,
    AUDIO;

    /**
     * Whether submissions of this kind are processed by the stage queues.
     *
     * @return {@code true} for image and video
     */
    public boolean isPipelineMedia() {
        return this == IMAGE || this == VIDEO;
    }

    /**
     * Infers the kind from a MIME type such as {@code video/mp4}.
     *
     * @param mimeType the MIME type, may be {@code null}
     * @return the matching kind, or {@link #TEXT} when the type is absent or unknown
     */
    public static MediaKind fromMimeType(String mimeType) {
        if (mimeType == null) {
            return TEXT;
        }
        String lower = mimeType.toLowerCase(Locale.ROOT);
        if (lower.startsWith("image/")) {
            return IMAGE;
        }
        if (lower.startsWith("video/")) {
            return VIDEO;
        }
        if (lower.startsWith("audio/")) {
            return AUDIO;
        }
        return TEXT;
    }
}
