package mediaflow.error;

/**
 * Thrown instead of calling the backend while the circuit breaker rejects calls.
 */
public final class CircuitOpenException extends InferenceException {

    public CircuitOpenException(String operation) {
        super(FailureKind.SERVICE_UNAVAILABLE, "Circuit open, rejected " + operation);
    }
}
