package portico.core.model.resilience;

import portico.core.model.routing.BackendService;

/**
 * Thrown when a circuit breaker short-circuits a call.
 */
public class CircuitOpenException extends RuntimeException {

    private final BackendService service;
    private final long retryAfterSeconds;

    public CircuitOpenException(BackendService service, long retryAfterSeconds) {
        super("Circuit breaker open for service " + service.id());
        this.service = service;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public BackendService getService() {
        return service;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
