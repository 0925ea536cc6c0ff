package portico.core.model.resilience;

/**
 * Circuit breaker states.
 */
public enum CircuitState {

    /** Calls pass through; failures are counted. */
    CLOSED,

    /** Calls fail immediately without reaching the backend. */
    OPEN,

    /** The reset timeout has elapsed; a single probe call decides the next state. */
    HALF_OPEN
}
