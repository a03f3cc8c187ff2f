package mediaflow;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable inbound event handed over by the transport collaborator.
 *
 * <p>{@code submissionId} identifies the inbound event for deduplication. The content
 * itself stays on local disk and is referenced by {@code contentRef}; the pipeline never
 * holds media bytes in memory. Use {@link #builder(String)} to create instances.
 */
public final class Submission {
    private final String submissionId;
    private final String conversationId;
    private final String originId;
    private final MediaKind kind;
    private final String contentRef;
    private final String mimeType;
    private final String text;
    private final Instant receivedAt;

    private Submission(Builder builder) {
        this.submissionId = requireText(builder.submissionId, "submissionId");
        this.conversationId = requireText(builder.conversationId, "conversationId");
        this.originId = builder.originId;
        this.mimeType = builder.mimeType;
        this.kind = builder.kind != null ? builder.kind : MediaKind.fromMimeType(builder.mimeType);
        this.contentRef = builder.contentRef;
        this.text = builder.text;
        this.receivedAt = builder.receivedAt != null ? builder.receivedAt : Instant.now();
        if (kind.isPipelineMedia() && (contentRef == null || contentRef.isEmpty())) {
            throw new IllegalArgumentException("contentRef is required for " + kind + " submissions");
        }
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
        return value;
    }

    /**
     * Creates a builder for the given inbound event id.
     *
     * @param submissionId id of the inbound event
     * @return a new builder
     */
    public static Builder builder(String submissionId) {
        return new Builder(submissionId);
    }

    public String submissionId() {
        return submissionId;
    }

    public String conversationId() {
        return conversationId;
    }

    /**
     * Identifier of the inbound message, used to quote it when replying.
     *
     * @return the origin id, or {@code null}
     */
    public String originId() {
        return originId;
    }

    public MediaKind kind() {
        return kind;
    }

    public String contentRef() {
        return contentRef;
    }

    public String mimeType() {
        return mimeType;
    }

    /**
     * Caption or prompt sent along with the media.
     *
     * @return the text, or {@code null}
     */
    public String text() {
        return text;
    }

    public Instant receivedAt() {
        return receivedAt;
    }

    @Override
    public String toString() {
        return "Submission{submissionId=" + submissionId
                + ", conversationId=" + conversationId
                + ", kind=" + kind
                + ", mimeType=" + mimeType + '}';
    }

    /**
     * Builder for {@link Submission}.
     */
    public static final class Builder {
        private final String submissionId;
        private String conversationId;
        private String originId;
        private MediaKind kind;
        private String contentRef;
        private String mimeType;
        private String text;
        private Instant receivedAt;

        private Builder(String submissionId) {
            this.submissionId = submissionId;
        }

        public Builder conversationId(String conversationId) {
            this.conversationId = conversationId;
            return this;
        }

        public Builder originId(String originId) {
            this.originId = originId;
            return this;
        }

        /**
         * Sets the kind explicitly. When unset it is inferred from the MIME type.
         *
         * @param kind the media kind
         * @return this builder
         */
        public Builder kind(MediaKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder contentRef(String contentRef) {
            this.contentRef = contentRef;
            return this;
        }

        public Builder mimeType(String mimeType) {
            this.mimeType = mimeType;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        /**
         * Builds the submission.
         *
         * @return a new submission
         * @throws NullPointerException     if {@code submissionId} or {@code conversationId} is null
         * @throws IllegalArgumentException if a required value is empty or image/video content has no reference
         */
        public Submission build() {
            return new Submission(this);
        }
    }
}
