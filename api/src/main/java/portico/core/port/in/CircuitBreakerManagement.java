package portico.core.port.in;

import java.util.List;

import portico.core.model.resilience.CircuitBreakerSnapshot;
import portico.core.model.routing.BackendService;

/**
 * Administrative access to the backend circuit breakers.
 */
public interface CircuitBreakerManagement {

    List<CircuitBreakerSnapshot> snapshots();

    /**
     * Force a breaker back to closed with a zero failure count.
     *
     * @return the snapshot after the reset
     */
    CircuitBreakerSnapshot reset(BackendService service);
}
