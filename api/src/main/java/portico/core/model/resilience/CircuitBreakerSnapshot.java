package portico.core.model.resilience;

import java.time.Instant;

import portico.core.model.routing.BackendService;

/**
 * Point-in-time view of a circuit breaker.
 *
 * @param service       backend guarded by the breaker
 * @param state         current state
 * @param failureCount  consecutive failures counted while closed
 * @param lastFailureAt time of the most recent failure, null if none
 * @param rejectedCalls calls short-circuited since startup
 */
public record CircuitBreakerSnapshot(
        BackendService service, CircuitState state, int failureCount, Instant lastFailureAt, long rejectedCalls) {}
