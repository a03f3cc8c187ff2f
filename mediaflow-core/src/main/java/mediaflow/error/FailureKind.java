package mediaflow.error;

/**
 * Classification attached to every stage failure.
 *
 * <p>Set by the inference client on {@link InferenceException}, or by the pipeline for
 * timeouts, open circuits and expired uploads. Unclassified exceptions become {@link #GENERAL}.
 */
public enum FailureKind {
    /** The backend refused the content on safety grounds. Never retried. */
    SAFETY_BLOCKED("safetyBlocked", false),
    /** The uploaded file is gone or did not finish processing in time. */
    FILE_EXPIRED("fileExpired", false),
    /** The backend no longer grants access to the uploaded file. */
    FILE_FORBIDDEN("fileForbidden", false),
    FILE_TOO_LARGE("fileTooLarge", false),
    UNSUPPORTED_FORMAT("unsupportedFormat", false),
    /** The backend reported the uploaded file as failed. */
    PROCESSING_FAILED("processingFailed", false),
    /** The call exceeded its timeout ceiling. Retried up to the stage attempt cap. */
    TIMEOUT("timeout", true),
    QUOTA_EXCEEDED("quotaExceeded", true),
    /** The circuit breaker rejected the call. Terminal for the job. */
    SERVICE_UNAVAILABLE("serviceUnavailable", false),
    GENERAL("general", true);

    private final String code;
    private final boolean retryable;

    FailureKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    /**
     * Stable identifier written to transaction history.
     *
     * @return the classification code
     */
    public String code() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Whether a failure of this kind indicates an unhealthy backend and should count
     * toward opening the circuit breaker. Content-related failures do not.
     *
     * @return {@code true} for timeouts, quota and general errors
     */
    public boolean isServiceFailure() {
        return this == TIMEOUT || this == QUOTA_EXCEEDED || this == GENERAL;
    }

    /**
     * Whether local and remote artifacts are kept after a terminal failure of this kind.
     *
     * @return {@code true} only for safety blocks
     */
    public boolean keepsArtifacts() {
        return this == SAFETY_BLOCKED;
    }
}
