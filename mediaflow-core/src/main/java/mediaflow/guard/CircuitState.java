package mediaflow.guard;

/**
 * State of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
