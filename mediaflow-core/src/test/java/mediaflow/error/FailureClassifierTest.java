package mediaflow.error;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailureClassifierTest {

    @Test
    void unwrapsExecutionWrappers() {
        InferenceException cause = new InferenceException(FailureKind.FILE_TOO_LARGE, "413");

        assertEquals(FailureKind.FILE_TOO_LARGE,
                FailureClassifier.classify(new ExecutionException(new CompletionException(cause))));
    }

    @Test
    void timeoutsAndUnknownErrors() {
        assertEquals(FailureKind.TIMEOUT, FailureClassifier.classify(new TimeoutException()));
        assertEquals(FailureKind.GENERAL, FailureClassifier.classify(new IllegalStateException("x")));
    }

    @Test
    void describeIncludesTypeAndMessage() {
        assertEquals("IllegalStateException: boom", FailureClassifier.describe(new IllegalStateException("boom")));
        assertEquals("TimeoutException", FailureClassifier.describe(new TimeoutException()));
        assertEquals("unknown error", FailureClassifier.describe(null));
    }

    @Test
    void onlyTransientKindsAreRetryable() {
        assertTrue(FailureKind.TIMEOUT.isRetryable());
        assertTrue(FailureKind.QUOTA_EXCEEDED.isRetryable());
        assertTrue(FailureKind.GENERAL.isRetryable());
        assertFalse(FailureKind.SAFETY_BLOCKED.isRetryable());
        assertFalse(FailureKind.SERVICE_UNAVAILABLE.isRetryable());
        assertFalse(FailureKind.SERVICE_UNAVAILABLE.isServiceFailure());
    }

    @Test
    void circuitOpenIsServiceUnavailable() {
        assertEquals(FailureKind.SERVICE_UNAVAILABLE, new CircuitOpenException("upload").kind());
    }
}
