package mediaflow.error;

import java.util.Objects;

/**
 * Failure raised at the inference boundary, carrying an explicit classification.
 */
public class InferenceException extends Exception {
    private final FailureKind kind;

    public InferenceException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public InferenceException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }
}
