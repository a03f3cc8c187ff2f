package mediaflow.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised inside a stage to a {@link FailureKind}.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    /**
     * Classifies a failure. Wrapper exceptions from executors are unwrapped first.
     *
     * @param failure the exception, may be {@code null}
     * @return the classification carried by an {@link InferenceException},
     *     {@link FailureKind#TIMEOUT} for timeouts, otherwise {@link FailureKind#GENERAL}
     */
    public static FailureKind classify(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof InferenceException inference) {
            return inference.kind();
        }
        if (current instanceof TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        return FailureKind.GENERAL;
    }

    /**
     * Short detail for history entries: the exception type and message, never a stack trace.
     *
     * @param failure the exception
     * @return a one-line description
     */
    public static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown error";
        }
        String message = failure.getMessage();
        String type = failure.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
